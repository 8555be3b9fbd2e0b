package io.tokenfeed.gateway.core;

import io.tokenfeed.gateway.config.FeedConfig;
import io.tokenfeed.gateway.connection.ConnectionClosedException;
import io.tokenfeed.gateway.connection.FeedConnection;
import io.tokenfeed.gateway.connection.FrameStream;
import io.tokenfeed.gateway.dispatch.EventDispatcher;
import io.tokenfeed.gateway.dispatch.FeedEventHandler;
import io.tokenfeed.gateway.dispatch.FrameClassifier;
import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.metrics.MetricsServer;
import io.tokenfeed.gateway.model.FeedEvent;
import io.tokenfeed.gateway.model.SubscriptionKind;
import io.tokenfeed.gateway.model.TokenCreatedEvent;
import io.tokenfeed.gateway.model.TradeEvent;
import io.tokenfeed.gateway.subscription.ControlFrameEncoder;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Main controller for the Token Feed Gateway.
 * Wires the feed connection, subscriptions, dispatch and the discovery bridge, and runs the
 * reader thread that drains inbound frames.
 */
public class FeedController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedController.class);

    private static final long READER_JOIN_TIMEOUT_MS = 5000;

    private final FeedConfig config;
    private final FeedMetrics metrics;
    private final FeedConnection connection;
    private final SubscriptionManager subscriptions;
    private final EventDispatcher dispatcher;
    private final TradeLogHandler tradeLog;
    private final HealthMonitor healthMonitor;
    private final MetricsServer metricsServer;
    private final TokenListWatcher tokenListWatcher;
    private final ShutdownSignalBarrier shutdownBarrier;

    private Thread readerThread;
    private volatile boolean started = false;
    private volatile boolean closing = false;
    private volatile boolean feedLost = false;

    public FeedController(FeedConfig config) {
        this(config, new FeedMetrics());
    }

    private FeedController(FeedConfig config, FeedMetrics metrics) {
        this(config, metrics, new FeedConnection(config, metrics));
    }

    /**
     * Creates a controller over an existing connection.
     *
     * @param config     Gateway configuration
     * @param metrics    Metrics sink shared with the connection
     * @param connection Feed connection, not yet connected
     */
    public FeedController(FeedConfig config, FeedMetrics metrics, FeedConnection connection) {
        this.config = config;
        this.metrics = metrics;
        this.connection = connection;
        this.subscriptions = new SubscriptionManager(connection::send, new ControlFrameEncoder(), metrics);
        this.connection.addConnectionListener(subscriptions);

        FrameClassifier classifier = new FrameClassifier(
            () -> subscriptions.desiredCount(SubscriptionKind.TOKEN_TRADE)
        );
        this.dispatcher = new EventDispatcher(classifier, metrics);
        this.tradeLog = new TradeLogHandler();

        // the bridge runs before any other created-token handler
        dispatcher.register(TokenCreatedEvent.class, new DiscoveryBridge(subscriptions, config.maxTrackedTokens()));
        dispatcher.register(TokenCreatedEvent.class, tradeLog::onCreated);
        dispatcher.register(TradeEvent.class, tradeLog::onTrade);

        this.healthMonitor = new HealthMonitor(config.name(), config.healthCheckMs(), connection::isConnected, subscriptions);
        this.metricsServer = config.metricsPort() > 0
            ? new MetricsServer(config.metricsPort(), metrics, config, healthMonitor, subscriptions)
            : null;
        this.tokenListWatcher = config.tokenFile() != null
            ? new TokenListWatcher(config.tokenFile(), config.tokenFilePollMs(), subscriptions)
            : null;
        this.shutdownBarrier = new ShutdownSignalBarrier();

        LOGGER.info("Feed controller initialized: {}", config.name());
    }

    /**
     * Registers a consumer for an event variant. Consumers run after the built-in handlers.
     */
    public <E extends FeedEvent> void subscribe(Class<E> eventClass, FeedEventHandler<? super E> handler) {
        dispatcher.register(eventClass, handler);
    }

    /**
     * Adds a topic to the desired set and reconciles it.
     *
     * @return true if the topic was not already desired
     * @throws IllegalArgumentException if the topic is blank, or is not
     *                                  {@link SubscriptionKind#NEW_TOKEN_TOPIC} for the discovery kind
     */
    public boolean addTopic(SubscriptionKind kind, String topic) {
        boolean changed = subscriptions.addDesired(kind, topic);
        if (changed) {
            subscriptions.reconcile(kind);
        }
        return changed;
    }

    /**
     * Removes a topic from the desired set and reconciles it.
     *
     * @return true if the topic was desired
     */
    public boolean removeTopic(SubscriptionKind kind, String topic) {
        boolean changed = subscriptions.removeDesired(kind, topic);
        if (changed) {
            subscriptions.reconcile(kind);
        }
        return changed;
    }

    /**
     * Seeds the desired sets from configuration, starts the reader thread and connects.
     */
    public void start() throws IOException {
        if (started) {
            LOGGER.warn("Feed controller already started");
            return;
        }
        started = true;
        LOGGER.info("Starting Token Feed Gateway...");

        if (config.subscribeNewTokens()) {
            subscriptions.addDesired(SubscriptionKind.NEW_TOKEN, SubscriptionKind.NEW_TOKEN_TOPIC);
        }
        if (!config.seedTokens().isEmpty()) {
            subscriptions.addDesired(SubscriptionKind.TOKEN_TRADE, config.seedTokens());
        }

        FrameStream frames = connection.receive();
        readerThread = new Thread(() -> readLoop(frames), config.name().toLowerCase() + "-reader");
        readerThread.start();

        healthMonitor.start();
        if (metricsServer != null) {
            metricsServer.start();
        }

        connection.connect();

        if (tokenListWatcher != null) {
            tokenListWatcher.start();
        }

        LOGGER.info("Token Feed Gateway started successfully");
        logStatus();
    }

    private void readLoop(FrameStream frames) {
        LOGGER.info("[{}] Reader started", config.name());
        while (frames.hasNext()) {
            String frame = frames.next();
            try {
                dispatcher.process(frame);
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Unexpected error processing frame", config.name(), e);
            }
        }

        ConnectionClosedException cause = frames.getTerminationCause();
        if (closing) {
            LOGGER.info("[{}] Reader stopped", config.name());
            return;
        }
        feedLost = true;
        LOGGER.error("[{}] Feed stream ended: {}", config.name(),
            cause != null ? cause.getMessage() : "reader interrupted");
        shutdownBarrier.signal();
    }

    /**
     * Waits for shutdown signal or for the feed stream to end.
     */
    public void waitForShutdown() {
        LOGGER.info("Gateway running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the gateway gracefully.
     */
    public void shutdown() {
        if (closing) {
            return;
        }
        closing = true;
        LOGGER.info("Shutting down Token Feed Gateway...");

        CloseHelper.closeAll(tokenListWatcher, healthMonitor, metricsServer, connection);

        if (readerThread != null) {
            try {
                readerThread.join(READER_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (readerThread.isAlive()) {
                LOGGER.warn("[{}] Reader did not stop within {} ms", config.name(), READER_JOIN_TIMEOUT_MS);
            }
        }

        LOGGER.info("Token Feed Gateway shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Logs current gateway status.
     */
    public void logStatus() {
        LOGGER.info("=== Gateway Status ===");
        LOGGER.info("Feed: {} ({})", config.name(), config.feedUri());
        LOGGER.info("Connected: {}", connection.isConnected());
        for (SubscriptionKind kind : SubscriptionKind.values()) {
            LOGGER.info("{}: desired={}, active={}",
                kind, subscriptions.desiredCount(kind), subscriptions.active(kind).size());
        }
        LOGGER.info("Frames received: {}", (long) metrics.getFramesReceived());
        LOGGER.info("=====================");
    }

    /**
     * @return true if the stream ended because the connection could not be re-established
     */
    public boolean isFeedLost() {
        return feedLost;
    }

    public SubscriptionManager getSubscriptionManager() {
        return subscriptions;
    }

    public FeedConnection getConnection() {
        return connection;
    }

    public FeedMetrics getMetrics() {
        return metrics;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public TradeLogHandler getTradeLogHandler() {
        return tradeLog;
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }
}
