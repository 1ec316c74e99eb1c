package io.computeorchestrator.cluster;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for long-running pool operations. Checked between migrations,
 * never in the middle of one.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
