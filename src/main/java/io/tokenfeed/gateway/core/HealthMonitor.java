package io.tokenfeed.gateway.core;

import io.tokenfeed.gateway.model.SubscriptionKind;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically checks the feed connection and reports subscription drift.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HealthMonitor.class);

    private final String name;
    private final long checkIntervalMs;
    private final ConnectionChecker checker;
    private final SubscriptionManager subscriptions;
    private final ScheduledExecutorService scheduler;

    private volatile boolean running = false;
    private volatile boolean lastConnected = false;
    private volatile long disconnectCount = 0;
    private volatile long lastDisconnectTime = 0;

    public HealthMonitor(String name, long checkIntervalMs, ConnectionChecker checker, SubscriptionManager subscriptions) {
        this.name = name;
        this.checkIntervalMs = checkIntervalMs;
        this.checker = checker;
        this.subscriptions = subscriptions;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts the health monitor.
     */
    public void start() {
        if (running) {
            return;
        }

        running = true;
        scheduler.scheduleAtFixedRate(
            this::performHealthCheckSafely,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );

        LOGGER.info("Health monitor started (interval: {} ms)", checkIntervalMs);
    }

    /**
     * Stops the health monitor.
     */
    public void stop() {
        if (!running) {
            scheduler.shutdownNow();
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Health monitor stopped");
    }

    /**
     * Checks the connection once. A transition from connected to disconnected counts as a disconnect.
     *
     * @return whether the connection is up
     */
    public boolean performHealthCheck() {
        boolean connected = checker.isConnected();
        if (!connected) {
            if (lastConnected) {
                disconnectCount++;
                lastDisconnectTime = System.currentTimeMillis();
            }
            LOGGER.warn("[HealthMonitor] {} is disconnected", name);
        } else {
            for (SubscriptionKind kind : SubscriptionKind.values()) {
                int desired = subscriptions.desiredCount(kind);
                int active = subscriptions.active(kind).size();
                if (desired != active) {
                    LOGGER.debug("[HealthMonitor] {} {}: desired={}, active={}", name, kind, desired, active);
                }
            }
        }
        lastConnected = connected;
        return connected;
    }

    private void performHealthCheckSafely() {
        try {
            performHealthCheck();
        } catch (Exception e) {
            LOGGER.error("Health check failed", e);
        }
    }

    /**
     * Logs a summary of connection statistics.
     */
    public void logSummary() {
        LOGGER.info("=== Health Monitor Summary ===");
        LOGGER.info("{}: connected={}, disconnectCount={}, lastDisconnect={}",
            name,
            checker.isConnected(),
            disconnectCount,
            lastDisconnectTime
        );
        for (SubscriptionKind kind : SubscriptionKind.values()) {
            LOGGER.info("{}: desired={}, active={}",
                kind, subscriptions.desiredCount(kind), subscriptions.active(kind).size());
        }
        LOGGER.info("=============================");
    }

    public boolean isConnected() {
        return checker.isConnected();
    }

    public long getDisconnectCount() {
        return disconnectCount;
    }

    public long getLastDisconnectTime() {
        return lastDisconnectTime;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Interface for checking connection status.
     */
    @FunctionalInterface
    public interface ConnectionChecker {
        boolean isConnected();
    }
}
