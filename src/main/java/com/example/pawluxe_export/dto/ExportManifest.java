package com.example.pawluxe_export.dto;

import com.example.pawluxe_export.selector.Excerpt;
import com.example.pawluxe_export.util.ClipKind;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JSON sidecar describing which recorded excerpts make up an export.
 */
public record ExportManifest(UUID jobId,
                             String cameraId,
                             Instant windowStart,
                             Instant windowEnd,
                             ClipKind kind,
                             String sourceEventId,
                             Instant createdAt,
                             List<Excerpt> excerpts) {
}
