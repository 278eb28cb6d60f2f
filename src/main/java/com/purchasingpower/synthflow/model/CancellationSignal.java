package com.purchasingpower.synthflow.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one synthesis run.
 *
 * <p>Checked at phase boundaries only. Nothing is rolled back because a run mutates no shared state.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
