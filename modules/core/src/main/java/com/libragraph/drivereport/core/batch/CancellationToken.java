package com.libragraph.drivereport.core.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one batch run. Checked before each extraction task starts;
 * a running extraction is never interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
