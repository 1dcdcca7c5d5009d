package org.pixelmorph.progress;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.pixelmorph.engine.AssignmentAlgorithm;
import org.pixelmorph.engine.MorphResult;
import org.pixelmorph.grid.RgbImage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Progress Channel Tests")
class ProgressChannelTest {

    @Nested
    @DisplayName("1. Messages")
    class MessageTests {

        @Test
        @DisplayName("Wire names and terminal kinds")
        void testKinds() {
            assertEquals("progress", ProgressMessage.progress(0.5f).typ());
            assertEquals("update_preview", ProgressMessage.Kind.UPDATE_PREVIEW.wireName());
            assertEquals("update_assignments", ProgressMessage.assignments(new int[]{0}).typ());
            assertEquals("cancelled", ProgressMessage.cancelled().typ());
            assertTrue(ProgressMessage.Kind.DONE.terminal());
            assertTrue(ProgressMessage.Kind.ERROR.terminal());
            assertTrue(ProgressMessage.Kind.CANCELLED.terminal());
            assertFalse(ProgressMessage.Kind.PROGRESS.terminal());
            assertFalse(ProgressMessage.Kind.UPDATE_ASSIGNMENTS.terminal());
        }

        @Test
        @DisplayName("Assignment payloads are copied in and out")
        void testAssignmentCopies() {
            int[] permutation = {1, 0};
            ProgressMessage message = ProgressMessage.assignments(permutation);
            permutation[0] = 7;
            message.assignments()[1] = 9;

            assertArrayEquals(new int[]{1, 0}, message.assignments());
        }

        @Test
        @DisplayName("Done carries the result")
        void testDone() {
            MorphResult result = MorphResult.builder()
                    .name("preset")
                    .source(RgbImage.fromPacked(1, 1, new int[]{0}))
                    .assignments(new int[]{0})
                    .totalCost(0L)
                    .algorithm(AssignmentAlgorithm.EXACT)
                    .build();
            ProgressMessage message = ProgressMessage.done(result);

            assertSame(result, message.result());
            assertNull(message.preview());
            assertTrue(Float.isNaN(message.fraction()));
            assertTrue(message.toString().contains("preset"));
        }

        @Test
        @DisplayName("Non-finite progress is rejected")
        void testNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> ProgressMessage.progress(Float.NaN));
        }
    }

    @Nested
    @DisplayName("2. Queue Sink")
    class QueueSinkTests {

        @Test
        @DisplayName("Single-slot channel keeps only the latest message")
        void testOverwriteOldest() {
            QueueProgressSink sink = new QueueProgressSink();
            sink.emit(ProgressMessage.progress(0.1f));
            sink.emit(ProgressMessage.progress(0.2f));
            sink.emit(ProgressMessage.progress(0.3f));

            assertEquals(1, sink.capacity());
            assertEquals(0.3f, sink.poll().fraction());
            assertNull(sink.poll());
            assertEquals(2L, sink.droppedCount());
        }

        @Test
        @DisplayName("Larger channel preserves order")
        void testOrder() {
            QueueProgressSink sink = new QueueProgressSink(4);
            sink.emit(ProgressMessage.progress(0.1f));
            sink.emit(ProgressMessage.cancelled());

            assertEquals(ProgressMessage.Kind.PROGRESS, sink.poll().kind());
            assertEquals(ProgressMessage.Kind.CANCELLED, sink.poll().kind());
            assertEquals(0L, sink.droppedCount());
        }

        @Test
        @DisplayName("Disconnected consumer drops messages silently")
        void testDisconnect() {
            QueueProgressSink sink = new QueueProgressSink(2);
            sink.emit(ProgressMessage.progress(0.1f));
            sink.disconnect();
            sink.emit(ProgressMessage.progress(0.2f));

            assertFalse(sink.isConnected());
            assertNull(sink.poll());
            assertEquals(1L, sink.droppedCount());
        }

        @Test
        @Timeout(value = 5, unit = TimeUnit.SECONDS)
        @DisplayName("Timed poll waits for a producer")
        void testTimedPoll() throws Exception {
            QueueProgressSink sink = new QueueProgressSink();
            Thread producer = new Thread(() -> sink.emit(ProgressMessage.cancelled()));
            producer.start();

            assertSame(ProgressMessage.cancelled(), sink.poll(2, TimeUnit.SECONDS));
            producer.join();
        }

        @Test
        @DisplayName("Capacity must be positive")
        void testCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new QueueProgressSink(0));
        }
    }

    @Nested
    @DisplayName("3. Callback Sink and Tokens")
    class CallbackAndTokenTests {

        @Test
        @DisplayName("Callback failures do not reach the solver")
        void testCallbackSwallowsFailure() {
            List<ProgressMessage> seen = new ArrayList<>();
            CallbackProgressSink sink = new CallbackProgressSink(message -> {
                seen.add(message);
                throw new IllegalStateException("consumer bug");
            });

            assertDoesNotThrow(() -> sink.emit(ProgressMessage.progress(0.5f)));
            assertEquals(1, seen.size());
        }

        @Test
        @DisplayName("Cancellation flag latches")
        void testFlag() {
            CancellationFlag flag = new CancellationFlag();
            assertFalse(flag.isCancellationRequested());
            flag.cancel();
            flag.cancel();
            assertTrue(flag.isCancellationRequested());
            assertFalse(CancellationToken.NONE.isCancellationRequested());
        }

        @Test
        @DisplayName("A newer session retires older tokens")
        void testSessionCounter() {
            DrawingSessionCounter counter = new DrawingSessionCounter();
            DrawingSessionCounter.SessionToken first = counter.begin();
            assertFalse(first.isCancellationRequested());

            DrawingSessionCounter.SessionToken second = counter.begin();
            assertTrue(first.isCancellationRequested());
            assertFalse(second.isCancellationRequested());
            assertEquals(2L, second.generation());

            counter.retireAll();
            assertTrue(second.isCancellationRequested());
            assertEquals(3L, counter.currentGeneration());
        }
    }
}
