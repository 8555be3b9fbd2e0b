package io.tokenfeed.gateway.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.hotspot.DefaultExports;
import io.tokenfeed.gateway.model.ControlFrame;
import io.tokenfeed.gateway.model.SubscriptionKind;

/**
 * Prometheus metrics collector for the Token Feed Gateway.
 *
 * Tracks:
 * - Inbound frames and dispatched events per event type
 * - Malformed frames and handler failures
 * - Control frames sent per subscription kind and action, and send failures
 * - Connection status, connection errors and reconnect attempts
 * - Desired and active topic counts per subscription kind
 */
public class FeedMetrics {

    private final CollectorRegistry registry;

    // Counters
    private final Counter framesReceived;
    private final Counter eventsDispatched;
    private final Counter malformedFrames;
    private final Counter handlerFailures;
    private final Counter controlFramesSent;
    private final Counter sendFailures;
    private final Counter connectionErrors;
    private final Counter reconnectAttempts;

    // Gauges
    private final Gauge connectionStatus;
    private final Gauge desiredTopics;
    private final Gauge activeTopics;

    /**
     * Registers with the default registry and exports JVM metrics.
     */
    public FeedMetrics() {
        this(CollectorRegistry.defaultRegistry);
        DefaultExports.initialize();
    }

    /**
     * Registers with the given registry. Tests use a private registry per instance.
     */
    public FeedMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.framesReceived = Counter.build()
            .name("feed_frames_received_total")
            .help("Total number of text frames received from the feed")
            .register(registry);

        this.eventsDispatched = Counter.build()
            .name("feed_events_dispatched_total")
            .help("Total number of classified events dispatched to handlers")
            .labelNames("event_type")
            .register(registry);

        this.malformedFrames = Counter.build()
            .name("feed_malformed_frames_total")
            .help("Total number of frames dropped because they could not be classified")
            .register(registry);

        this.handlerFailures = Counter.build()
            .name("feed_handler_failures_total")
            .help("Total number of exceptions raised by event handlers")
            .labelNames("event_type")
            .register(registry);

        this.controlFramesSent = Counter.build()
            .name("feed_control_frames_sent_total")
            .help("Total number of subscribe and unsubscribe frames sent")
            .labelNames("kind", "action")
            .register(registry);

        this.sendFailures = Counter.build()
            .name("feed_send_failures_total")
            .help("Total number of control frames that could not be sent")
            .register(registry);

        this.connectionErrors = Counter.build()
            .name("feed_connection_errors_total")
            .help("Total number of connection errors")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("feed_reconnect_attempts_total")
            .help("Total number of reconnection attempts")
            .register(registry);

        // 1 = connected, 0 = disconnected
        this.connectionStatus = Gauge.build()
            .name("feed_connection_status")
            .help("Connection status to the feed (1 = connected, 0 = disconnected)")
            .register(registry);

        this.desiredTopics = Gauge.build()
            .name("feed_desired_topics")
            .help("Number of topics the application wants subscribed")
            .labelNames("kind")
            .register(registry);

        this.activeTopics = Gauge.build()
            .name("feed_active_topics")
            .help("Number of topics believed subscribed on the live connection")
            .labelNames("kind")
            .register(registry);
    }

    public void recordFrameReceived() {
        framesReceived.inc();
    }

    public void recordEventDispatched(String eventType) {
        eventsDispatched.labels(eventType).inc();
    }

    public void recordMalformedFrame() {
        malformedFrames.inc();
    }

    public void recordHandlerFailure(String eventType) {
        handlerFailures.labels(eventType).inc();
    }

    public void recordControlFrameSent(ControlFrame frame) {
        controlFramesSent.labels(frame.kind().name(), frame.action().name()).inc();
    }

    public void recordSendFailure() {
        sendFailures.inc();
    }

    public void recordConnectionError() {
        connectionErrors.inc();
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.inc();
    }

    /**
     * Sets the connection status.
     *
     * @param connected true if connected, false otherwise
     */
    public void setConnectionStatus(boolean connected) {
        connectionStatus.set(connected ? 1 : 0);
    }

    /**
     * Publishes desired and active set sizes for a subscription kind.
     */
    public void setTopicCounts(SubscriptionKind kind, int desired, int active) {
        desiredTopics.labels(kind.name()).set(desired);
        activeTopics.labels(kind.name()).set(active);
    }

    public double getFramesReceived() {
        return framesReceived.get();
    }

    public double getEventsDispatched(String eventType) {
        return eventsDispatched.labels(eventType).get();
    }

    public double getMalformedFrames() {
        return malformedFrames.get();
    }

    public double getHandlerFailures(String eventType) {
        return handlerFailures.labels(eventType).get();
    }

    public double getControlFramesSent(SubscriptionKind kind, ControlFrame.Action action) {
        return controlFramesSent.labels(kind.name(), action.name()).get();
    }

    public double getSendFailures() {
        return sendFailures.get();
    }

    public double getReconnectAttempts() {
        return reconnectAttempts.get();
    }

    /**
     * Returns the CollectorRegistry for the HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
