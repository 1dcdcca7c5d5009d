package org.pixelmorph.progress;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded cross-thread channel between a worker-side solver and a UI-side consumer.
 *
 * <ul>
 * <li>{@link #emit(ProgressMessage)} never blocks: when the queue is full the oldest pending
 * message is dropped to make room.</li>
 * <li>After {@link #disconnect()} the consumer is considered gone; emits are dropped and
 * logged instead of failing the solver.</li>
 * </ul>
 */
@Accessors(fluent = true)
public final class QueueProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(QueueProgressSink.class);

    /** Capacity used by the native UI channel. */
    public static final int DEFAULT_CAPACITY = 1;

    private final ArrayBlockingQueue<ProgressMessage> queue;
    private final Object producerLock = new Object();
    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final AtomicLong dropped = new AtomicLong();

    @Getter
    private final int capacity;

    public QueueProgressSink() {
        this(DEFAULT_CAPACITY);
    }

    public QueueProgressSink(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public void emit(ProgressMessage message) {
        Objects.requireNonNull(message, "message");
        if (!connected.get()) {
            dropped.incrementAndGet();
            log.debug("consumer disconnected, dropping {}", message.typ());
            return;
        }
        synchronized (producerLock) {
            while (!queue.offer(message)) {
                ProgressMessage overwritten = queue.poll();
                if (overwritten != null) {
                    dropped.incrementAndGet();
                    log.trace("channel full, overwrote pending {}", overwritten.typ());
                }
            }
        }
    }

    /**
     * Takes the next pending message, or {@code null} when none is queued.
     */
    public ProgressMessage poll() {
        return queue.poll();
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return next message, or {@code null} when the timeout elapsed.
     * @throws InterruptedException when the waiting thread is interrupted.
     */
    public ProgressMessage poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Marks the consumer as gone and clears pending messages.
     */
    public void disconnect() {
        connected.set(false);
        queue.clear();
    }

    public boolean isConnected() {
        return connected.get();
    }

    /**
     * Number of messages overwritten or discarded so far.
     */
    public long droppedCount() {
        return dropped.get();
    }
}
