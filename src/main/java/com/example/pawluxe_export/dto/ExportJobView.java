package com.example.pawluxe_export.dto;

import com.example.pawluxe_export.model.ExportJob;
import com.example.pawluxe_export.util.ExportJobStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only projection of a job for operators.
 */
public record ExportJobView(UUID id,
                            String dedupeKey,
                            ExportJobStatus status,
                            int retryCount,
                            int maxRetries,
                            int timeoutSeconds,
                            Instant nextRunAt,
                            Instant createdAt,
                            Instant startedAt,
                            Instant finishedAt,
                            Instant canceledAt,
                            String errorMessage,
                            String outputPath,
                            String manifestPath,
                            String sourceEventId) {

    public static ExportJobView from(ExportJob job) {
        return new ExportJobView(
                job.getId(),
                job.getDedupeKey(),
                job.getStatus(),
                job.getRetryCount(),
                job.getMaxRetries(),
                job.getTimeoutSeconds(),
                job.getNextRunAt(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getFinishedAt(),
                job.getCanceledAt(),
                job.getErrorMessage(),
                job.getOutputPath(),
                job.getManifestPath(),
                job.getSourceEventId()
        );
    }
}
