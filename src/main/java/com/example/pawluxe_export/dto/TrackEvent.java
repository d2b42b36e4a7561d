package com.example.pawluxe_export.dto;

import java.time.Instant;

/**
 * Detection/track observation published by the ingestion pipeline.
 *
 * @param identity resolved animal identity, {@code null} while unresolved.
 */
public record TrackEvent(String eventId,
                         String cameraId,
                         Instant timestamp,
                         BoundingBox box,
                         double confidence,
                         String identity) {
}
