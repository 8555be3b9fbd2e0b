package io.tokenfeed.gateway.netty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Handles automatic reconnection with bounded exponential backoff.
 * At most one attempt is pending at any time; when the retry budget is spent the
 * give-up callback runs once and the handler stops.
 */
public class ReconnectHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectHandler.class);

    private static final double BACKOFF_MULTIPLIER = 1.5;

    private final String name;
    private final int maxRetries;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final Runnable connectAction;
    private final Runnable giveUpAction;

    private ScheduledExecutorService scheduler;
    private int retryCount = 0;
    private long currentDelay;
    private boolean pending = false;
    private volatile boolean running = false;

    /**
     * Creates a new reconnect handler.
     *
     * @param name           Friendly name for logging
     * @param maxRetries     Maximum number of reconnection attempts (-1 for unlimited)
     * @param initialDelayMs Delay before the first attempt
     * @param maxDelayMs     Upper bound for the delay between attempts
     * @param connectAction  Action to perform when reconnecting; throwing counts as a failed attempt
     * @param giveUpAction   Action to perform once the retry budget is exhausted
     */
    public ReconnectHandler(
        String name,
        int maxRetries,
        long initialDelayMs,
        long maxDelayMs,
        Runnable connectAction,
        Runnable giveUpAction
    ) {
        this.name = name;
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.connectAction = connectAction;
        this.giveUpAction = giveUpAction;
        this.currentDelay = initialDelayMs;
    }

    /**
     * Starts the reconnect handler.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name.toLowerCase() + "-reconnect-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.info("{}: Reconnect handler started", name);
    }

    /**
     * Stops the reconnect handler. Pending attempts are cancelled.
     */
    public synchronized void stop() {
        running = false;
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        pending = false;
        retryCount = 0;
        currentDelay = initialDelayMs;
        LOGGER.info("{}: Reconnect handler stopped", name);
    }

    /**
     * Schedules a reconnection attempt with exponential backoff.
     * A call while an attempt is already pending is ignored.
     */
    public synchronized void scheduleReconnect() {
        if (!running) {
            LOGGER.debug("{}: Reconnect handler not running", name);
            return;
        }
        if (pending) {
            LOGGER.debug("{}: Reconnect already pending", name);
            return;
        }

        if (maxRetries >= 0 && retryCount >= maxRetries) {
            LOGGER.error("{}: Max reconnect retries ({}) reached, giving up", name, maxRetries);
            stop();
            if (giveUpAction != null) {
                giveUpAction.run();
            }
            return;
        }

        retryCount++;
        pending = true;
        int attempt = retryCount;
        long delay = currentDelay;
        LOGGER.info("{}: Scheduling reconnect attempt {} in {} ms", name, attempt, delay);

        scheduler.schedule(() -> runAttempt(attempt), delay, TimeUnit.MILLISECONDS);
    }

    private void runAttempt(int attempt) {
        synchronized (this) {
            pending = false;
            if (!running) {
                return;
            }
        }
        try {
            LOGGER.info("{}: Attempting reconnection #{}", name, attempt);
            connectAction.run();
        } catch (Exception e) {
            LOGGER.warn("{}: Reconnect attempt #{} failed: {}", name, attempt, e.getMessage());
            synchronized (this) {
                currentDelay = Math.min((long) (currentDelay * BACKOFF_MULTIPLIER), maxDelayMs);
            }
            scheduleReconnect();
        }
    }

    /**
     * Resets the reconnect state (called on successful connection).
     */
    public synchronized void reset() {
        retryCount = 0;
        currentDelay = initialDelayMs;
        LOGGER.debug("{}: Reconnect state reset", name);
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized int getRetryCount() {
        return retryCount;
    }

    /**
     * Returns the delay that the next scheduled attempt would wait.
     */
    public synchronized long getCurrentDelay() {
        return currentDelay;
    }
}
