package com.example.pawluxe_export.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A recorded file of one camera covering {@code [start, end)}.
 *
 * @param segmentId id of the recording in the media catalog; informational only.
 * @param path      local path of the recorded file.
 */
public record SourceSegment(String segmentId,
                            @NotBlank String path,
                            @NotNull Instant start,
                            @NotNull Instant end) {
}
