package io.tokenfeed.gateway.connection;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FrameStream.
 */
class FrameStreamTest {

    @Test
    void testFramesBeforeTerminationAreDelivered() {
        FrameStream stream = new FrameStream();
        stream.offer("a");
        stream.offer("b");
        stream.terminate(new ConnectionClosedException("closed"));

        List<String> frames = new ArrayList<>();
        stream.forEachRemaining(frames::add);

        assertEquals(List.of("a", "b"), frames);
        assertEquals("closed", stream.getTerminationCause().getMessage());
    }

    @Test
    void testFramesAfterTerminationAreDropped() {
        FrameStream stream = new FrameStream();
        stream.terminate(new ConnectionClosedException("closed"));
        stream.offer("late");

        assertFalse(stream.hasNext());
    }

    @Test
    void testOnlyFirstTerminationCauseKept() {
        FrameStream stream = new FrameStream();
        stream.terminate(new ConnectionClosedException("first"));
        stream.terminate(new ConnectionClosedException("second"));

        ConnectionClosedException e = assertThrows(ConnectionClosedException.class, stream::next);
        assertEquals("first", e.getMessage());
    }

    @Test
    void testHasNextBlocksUntilFrameArrives() throws Exception {
        FrameStream stream = new FrameStream();
        CountDownLatch reading = new CountDownLatch(1);
        List<String> received = new ArrayList<>();

        Thread reader = new Thread(() -> {
            reading.countDown();
            if (stream.hasNext()) {
                received.add(stream.next());
            }
        });
        reader.start();
        assertTrue(reading.await(1, TimeUnit.SECONDS));

        stream.offer("frame");
        reader.join(2000);

        assertFalse(reader.isAlive());
        assertEquals(List.of("frame"), received);
    }

    @Test
    void testHasNextIsIdempotent() {
        FrameStream stream = new FrameStream();
        stream.offer("only");

        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            assertTrue(stream.hasNext());
            assertTrue(stream.hasNext());
            assertEquals("only", stream.next());
        });
        assertFalse(stream.isTerminated());
    }
}
