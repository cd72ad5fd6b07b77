package com.rivaflow.backend.global.common;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag for synchronous searches. A search that observes
 * a cancelled token stops early and returns an empty result.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
