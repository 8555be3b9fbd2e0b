package io.tokenfeed.gateway.core;

import io.prometheus.client.CollectorRegistry;
import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.subscription.ControlFrameEncoder;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HealthMonitor.
 */
class HealthMonitorTest {

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final SubscriptionManager subscriptions = new SubscriptionManager(
        frame -> { }, new ControlFrameEncoder(), new FeedMetrics(new CollectorRegistry()));

    @Test
    void testCountsTransitionsToDisconnected() {
        try (HealthMonitor monitor = new HealthMonitor("test", 1000, connected::get, subscriptions)) {
            assertFalse(monitor.performHealthCheck());
            assertEquals(0, monitor.getDisconnectCount());

            connected.set(true);
            assertTrue(monitor.performHealthCheck());

            connected.set(false);
            monitor.performHealthCheck();
            monitor.performHealthCheck();

            assertEquals(1, monitor.getDisconnectCount());
            assertTrue(monitor.getLastDisconnectTime() > 0);
        }
    }

    @Test
    void testReportsCurrentConnectionState() {
        try (HealthMonitor monitor = new HealthMonitor("test", 1000, connected::get, subscriptions)) {
            assertFalse(monitor.isConnected());
            connected.set(true);
            assertTrue(monitor.isConnected());
            monitor.logSummary();
        }
    }
}
