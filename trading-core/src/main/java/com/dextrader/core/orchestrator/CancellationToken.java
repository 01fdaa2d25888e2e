package com.dextrader.core.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag checked between evaluation cycles.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call cancelled the token, false if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
