package com.example.pawluxe_export.exception;

import com.example.pawluxe_export.util.ExportJobStatus;

import java.util.UUID;

/**
 * The caller assumed a prior state that no longer holds. Nothing was changed.
 */
public class InvalidTransitionException extends RuntimeException {
    private final UUID jobId;
    private final ExportJobStatus current;
    private final ExportJobStatus attempted;

    public InvalidTransitionException(UUID jobId, ExportJobStatus current, ExportJobStatus attempted) {
        this(jobId, current, attempted, null);
    }

    public InvalidTransitionException(UUID jobId, ExportJobStatus current, ExportJobStatus attempted, String reason) {
        super("Illegal transition for job " + jobId + ": " + current + " -> " + attempted
                + (reason == null ? "" : " (" + reason + ")"));
        this.jobId = jobId;
        this.current = current;
        this.attempted = attempted;
    }

    public UUID getJobId() {
        return jobId;
    }

    public ExportJobStatus getCurrent() {
        return current;
    }

    public ExportJobStatus getAttempted() {
        return attempted;
    }
}
