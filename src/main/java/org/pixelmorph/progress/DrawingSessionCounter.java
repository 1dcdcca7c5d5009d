package org.pixelmorph.progress;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic generation counter for drawing sessions.
 *
 * <p>{@link #begin()} starts a new session and returns a token bound to it. A token reports
 * cancellation as soon as a later session has begun, which retires background solvers
 * without touching their threads.</p>
 */
public final class DrawingSessionCounter {
    private final AtomicLong current = new AtomicLong();

    /**
     * Increments the live generation id and returns a token capturing it.
     */
    public SessionToken begin() {
        return new SessionToken(this, current.incrementAndGet());
    }

    /**
     * Retires every outstanding session token without starting a solver.
     */
    public void retireAll() {
        current.incrementAndGet();
    }

    public long currentGeneration() {
        return current.get();
    }

    /**
     * Token bound to one drawing generation.
     */
    public static final class SessionToken implements CancellationToken {
        private final DrawingSessionCounter counter;
        private final long generation;

        private SessionToken(DrawingSessionCounter counter, long generation) {
            this.counter = counter;
            this.generation = generation;
        }

        public long generation() {
            return generation;
        }

        @Override
        public boolean isCancellationRequested() {
            return counter.current.get() != generation;
        }
    }
}
