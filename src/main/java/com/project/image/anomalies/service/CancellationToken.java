package com.project.image.anomalies.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a detection run, honoured between frames, never mid-algorithm.
 */
public final class CancellationToken {
    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
