package io.tokenfeed.gateway.netty;

import io.tokenfeed.gateway.TestWait;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectHandler.
 */
class ReconnectHandlerTest {

    @Test
    void testGivesUpAfterMaxRetries() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        CountDownLatch gaveUp = new CountDownLatch(1);
        ReconnectHandler handler = new ReconnectHandler("test", 2, 5, 20,
            () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("refused");
            },
            gaveUp::countDown);

        handler.start();
        handler.scheduleReconnect();

        assertTrue(gaveUp.await(2, TimeUnit.SECONDS));
        assertEquals(2, attempts.get());
        assertFalse(handler.isRunning());
    }

    @Test
    void testBackoffIsCapped() {
        AtomicInteger attempts = new AtomicInteger();
        ReconnectHandler handler = new ReconnectHandler("test", -1, 10, 30,
            () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("refused");
            },
            () -> fail("unlimited retries must not give up"));

        handler.start();
        try {
            handler.scheduleReconnect();
            // 10 -> 15 -> 22 -> 30 -> 30
            TestWait.until(() -> attempts.get() >= 5, 3000, "five attempts");
            assertEquals(30, handler.getCurrentDelay());
        } finally {
            handler.stop();
        }
    }

    @Test
    void testOnlyOneAttemptPending() throws Exception {
        CountDownLatch connected = new CountDownLatch(1);
        AtomicInteger attempts = new AtomicInteger();
        ReconnectHandler handler = new ReconnectHandler("test", 5, 100, 1000,
            () -> {
                attempts.incrementAndGet();
                connected.countDown();
            },
            () -> { });

        handler.start();
        try {
            handler.scheduleReconnect();
            handler.scheduleReconnect();
            handler.scheduleReconnect();

            assertEquals(1, handler.getRetryCount());
            assertTrue(connected.await(2, TimeUnit.SECONDS));
            Thread.sleep(200);
            assertEquals(1, attempts.get());
        } finally {
            handler.stop();
        }
    }

    @Test
    void testScheduleIgnoredWhenNotRunning() {
        ReconnectHandler handler = new ReconnectHandler("test", 5, 10, 100, () -> { }, () -> { });

        handler.scheduleReconnect();

        assertEquals(0, handler.getRetryCount());
    }

    @Test
    void testResetRestoresInitialState() {
        AtomicInteger attempts = new AtomicInteger();
        ReconnectHandler handler = new ReconnectHandler("test", -1, 10, 100,
            () -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("refused");
            },
            () -> { });

        handler.start();
        try {
            handler.scheduleReconnect();
            TestWait.until(() -> attempts.get() >= 2, 2000, "two attempts");
        } finally {
            handler.stop();
        }

        handler.reset();
        assertEquals(0, handler.getRetryCount());
        assertEquals(10, handler.getCurrentDelay());
    }
}
