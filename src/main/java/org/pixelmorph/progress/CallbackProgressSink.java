package org.pixelmorph.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Direct-dispatch sink for single-threaded hosts where the solver and the consumer share
 * one worker. Callback failures are logged and swallowed.
 */
public final class CallbackProgressSink implements ProgressSink {
    private static final Logger log = LoggerFactory.getLogger(CallbackProgressSink.class);

    private final Consumer<ProgressMessage> callback;

    public CallbackProgressSink(Consumer<ProgressMessage> callback) {
        this.callback = Objects.requireNonNull(callback, "callback");
    }

    @Override
    public void emit(ProgressMessage message) {
        Objects.requireNonNull(message, "message");
        try {
            callback.accept(message);
        } catch (RuntimeException ex) {
            log.warn("progress callback failed for {}", message.typ(), ex);
        }
    }
}
