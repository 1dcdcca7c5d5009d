package org.pixelmorph.progress;

/**
 * Consumer-owned endpoint that solvers report into.
 *
 * <p>Implementations must never block the solver and must not propagate delivery
 * failures: a consumer that went away is not fatal to a running solve.</p>
 */
@FunctionalInterface
public interface ProgressSink {
    /** Sink that discards every message. */
    ProgressSink DISCARD = message -> {
    };

    /**
     * Delivers one message, best effort.
     */
    void emit(ProgressMessage message);
}
