package com.example.pawluxe_export.exception;

public class TransientRenderFailureException extends RenderException {
    public TransientRenderFailureException(String message) {
        super(message);
    }

    public TransientRenderFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
