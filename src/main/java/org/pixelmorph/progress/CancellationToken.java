package org.pixelmorph.progress;

/**
 * Cooperative cancellation signal handed to a solver at start and polled at its check cadence.
 */
@FunctionalInterface
public interface CancellationToken {
    /** Token that is never cancelled. */
    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
