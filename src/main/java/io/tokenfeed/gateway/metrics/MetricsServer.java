package io.tokenfeed.gateway.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.tokenfeed.gateway.config.FeedConfig;
import io.tokenfeed.gateway.core.HealthMonitor;
import io.tokenfeed.gateway.model.EventType;
import io.tokenfeed.gateway.model.SubscriptionKind;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP server for Prometheus metrics, a liveness check and a JSON status view.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final FeedMetrics metrics;
    private final FeedConfig config;
    private final HealthMonitor healthMonitor;
    private final SubscriptionManager subscriptions;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    public MetricsServer(int port, FeedMetrics metrics, FeedConfig config,
                         HealthMonitor healthMonitor, SubscriptionManager subscriptions) {
        this.port = port;
        this.metrics = metrics;
        this.config = config;
        this.healthMonitor = healthMonitor;
        this.subscriptions = subscriptions;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());

        server.setExecutor(null);
        server.start();

        int boundPort = getPort();
        LOGGER.info("HTTP server started on port {}", boundPort);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", boundPort);
        LOGGER.info("  Health:     http://localhost:{}/health", boundPort);
        LOGGER.info("  API Status: http://localhost:{}/api/status", boundPort);
    }

    /**
     * @return the bound port, or the configured one before {@link #start()}
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                boolean healthy = healthMonitor.isConnected();
                HealthResponse health = new HealthResponse(
                    healthy,
                    healthy ? "Feed connected" : config.name() + " disconnected"
                );
                String response = objectMapper.writeValueAsString(health);
                send(exchange, healthy ? 200 : 503, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                send(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                Map<String, TopicStatus> topics = new LinkedHashMap<>();
                for (SubscriptionKind kind : SubscriptionKind.values()) {
                    topics.put(kind.name(), new TopicStatus(
                        subscriptions.desiredCount(kind),
                        subscriptions.active(kind).size()
                    ));
                }

                StatusResponse status = new StatusResponse(
                    config.name(),
                    config.feedUri().toString(),
                    System.currentTimeMillis() - startTime,
                    healthMonitor.isConnected(),
                    healthMonitor.getDisconnectCount(),
                    (long) metrics.getFramesReceived(),
                    (long) metrics.getEventsDispatched(EventType.CREATED.name()),
                    (long) metrics.getEventsDispatched(EventType.TRADE.name()),
                    (long) metrics.getMalformedFrames(),
                    topics
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status);
                send(exchange, 200, "application/json", response);
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                send(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String response)
            throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(statusCode, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record HealthResponse(boolean healthy, String message) {}

    private record TopicStatus(int desired, int active) {}

    private record StatusResponse(String name, String feedUri, long uptimeMs, boolean connected,
                                  long disconnectCount, long framesReceived, long tokensCreated,
                                  long trades, long malformedFrames, Map<String, TopicStatus> subscriptions) {}
}
