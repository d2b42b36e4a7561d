package com.example.pawluxe_export.exception;

public class PermanentRenderFailureException extends RenderException {
    public PermanentRenderFailureException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
