package com.example.pawluxe_export.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of an export job and the transitions allowed between them.
 * <pre>
 * PENDING  -> RUNNING (claim) | CANCELED (operator)
 * RUNNING  -> DONE | PENDING (retryable failure, budget left) | FAILED | CANCELED
 * FAILED   -> PENDING (operator retry)
 * CANCELED -> PENDING (operator retry)
 * DONE     -> (none)
 * </pre>
 */
public enum ExportJobStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    CANCELED;

    public Set<ExportJobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELED);
            case RUNNING -> EnumSet.of(DONE, PENDING, FAILED, CANCELED);
            case FAILED, CANCELED -> EnumSet.of(PENDING);
            case DONE -> EnumSet.noneOf(ExportJobStatus.class);
        };
    }

    public boolean canTransitionTo(ExportJobStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    /** Pending or running; the states that hold a dedupe key. */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
