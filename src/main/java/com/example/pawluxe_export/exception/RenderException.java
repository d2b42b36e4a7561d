package com.example.pawluxe_export.exception;

/**
 * Failure of one render attempt. {@link #isRetryable()} decides whether the job store may schedule
 * another attempt.
 */
public abstract class RenderException extends Exception {
    protected RenderException(String message) {
        super(message);
    }

    protected RenderException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
