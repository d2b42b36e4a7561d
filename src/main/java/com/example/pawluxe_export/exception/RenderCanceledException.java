package com.example.pawluxe_export.exception;

/**
 * The render was aborted because the job is no longer owned by this worker. Not a failure: the job
 * already carries its final state.
 */
public class RenderCanceledException extends RenderException {
    public RenderCanceledException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
