package com.example.pawluxe_export.dto;

import com.example.pawluxe_export.util.ClipKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

/**
 * What to render: a time window of one camera, the recordings that cover it, and the clip kind.
 *
 * @param sourceEventId id of the upstream detection event that asked for this clip. Only a lookup key;
 *                      the event itself stays with the ingestion pipeline.
 * @param renderVideo   {@code false} to produce only the excerpt manifest; {@code null} means true.
 */
public record RenderParams(@NotBlank @Size(max = 64) String cameraId,
                           @NotNull Instant windowStart,
                           @NotNull Instant windowEnd,
                           @NotNull ClipKind kind,
                           @NotEmpty List<@Valid @NotNull SourceSegment> segments,
                           @Size(max = 64) String sourceEventId,
                           Boolean renderVideo) {

    public boolean shouldRenderVideo() {
        return renderVideo == null || renderVideo;
    }
}
