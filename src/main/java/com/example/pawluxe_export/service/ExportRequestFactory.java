package com.example.pawluxe_export.service;

import com.example.pawluxe_export.config.ExportQueueProperties;
import com.example.pawluxe_export.dto.EnqueueRequest;
import com.example.pawluxe_export.dto.RenderParams;
import com.example.pawluxe_export.dto.SourceSegment;
import com.example.pawluxe_export.dto.TrackEvent;
import com.example.pawluxe_export.exception.MalformedRequestException;
import com.example.pawluxe_export.util.ClipKind;
import com.example.pawluxe_export.util.DedupeKeys;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives "render this window" requests from detection events of the ingestion pipeline.
 */
@Component
public class ExportRequestFactory {
    private final ExportQueueProperties properties;

    public ExportRequestFactory(ExportQueueProperties properties) {
        this.properties = properties;
    }

    /**
     * Window is the event time plus and minus the configured padding; the event id is kept only as a
     * back-reference.
     *
     * @param segments recordings of the event's camera that cover the window.
     */
    public EnqueueRequest fromTrackEvent(TrackEvent event, List<SourceSegment> segments, ClipKind kind) {
        if (event == null) {
            throw new MalformedRequestException("event is required");
        }
        List<String> problems = new ArrayList<>();
        if (event.cameraId() == null || event.cameraId().isBlank()) {
            problems.add("event.cameraId must not be blank");
        }
        if (event.timestamp() == null) {
            problems.add("event.timestamp is required");
        }
        if (event.box() == null || !event.box().isValid()) {
            problems.add("event.box must have a non-negative origin and positive size");
        }
        double minConfidence = properties.getIngest().getMinConfidence();
        if (Double.isNaN(event.confidence()) || event.confidence() < minConfidence || event.confidence() > 1.0) {
            problems.add("event.confidence must be within [" + minConfidence + ", 1]");
        }
        if (!problems.isEmpty()) {
            throw new MalformedRequestException(problems);
        }

        Duration padding = properties.getIngest().getPadding();
        Instant start = event.timestamp().minus(padding);
        Instant end = event.timestamp().plus(padding);
        RenderParams params = new RenderParams(event.cameraId().trim(), start, end,
                kind == null ? ClipKind.FULL : kind,
                segments == null ? List.of() : List.copyOf(segments),
                event.eventId(), true);
        return new EnqueueRequest(DedupeKeys.derive(params), params, null, null);
    }
}
