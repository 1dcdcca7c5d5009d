package org.pixelmorph.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared boolean cancellation flag, set by the consumer and read by the solver.
 */
public final class CancellationFlag implements CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
