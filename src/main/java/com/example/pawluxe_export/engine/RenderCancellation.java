package com.example.pawluxe_export.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abort flag shared between the dispatcher's heartbeat and a running render.
 */
public class RenderCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
