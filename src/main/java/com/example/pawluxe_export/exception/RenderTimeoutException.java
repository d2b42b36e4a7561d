package com.example.pawluxe_export.exception;

import java.time.Duration;

/**
 * The attempt ran past its wall-clock bound. Retried like any other transient failure.
 */
public class RenderTimeoutException extends TransientRenderFailureException {
    private final Duration timeout;

    public RenderTimeoutException(Duration timeout) {
        super("render timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
