package io.tokenfeed.gateway.config;

import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for the Token Feed Gateway.
 *
 * @param name                    Friendly name for the feed connection (used in logs)
 * @param feedUri                 WebSocket URI of the feed
 * @param subscribeNewTokens      Whether the discovery stream is desired at startup
 * @param seedTokens              Mints whose trades are desired at startup
 * @param tokenFile               Optional token list file polled for the desired trade set (null to disable)
 * @param tokenFilePollMs         Token list file poll interval in milliseconds
 * @param maxTrackedTokens        Cap on discovered mints added to the trade set (0 for unlimited)
 * @param reconnectMaxRetries     Maximum reconnect retries (-1 for unlimited)
 * @param reconnectInitialDelayMs First reconnect delay in milliseconds
 * @param reconnectMaxDelayMs     Upper bound of the reconnect delay in milliseconds
 * @param sendTimeoutMs           How long a control frame write may take before the connection is considered lost
 * @param pingIntervalMs          Writer idle time after which a ping is sent (0 to disable)
 * @param healthCheckMs           Health check interval in milliseconds
 * @param metricsPort             Port for the metrics and status HTTP server (0 to disable)
 * @param compression             Whether WebSocket permessage-deflate is negotiated
 */
public record FeedConfig(
    String name,
    URI feedUri,
    boolean subscribeNewTokens,
    Set<String> seedTokens,
    Path tokenFile,
    long tokenFilePollMs,
    int maxTrackedTokens,
    int reconnectMaxRetries,
    long reconnectInitialDelayMs,
    long reconnectMaxDelayMs,
    long sendTimeoutMs,
    long pingIntervalMs,
    int healthCheckMs,
    int metricsPort,
    boolean compression
) {
    public static final String DEFAULT_FEED_URI = "wss://pumpportal.fun/api/data";

    private static final String DEFAULT_NAME = "PumpPortal";
    private static final long DEFAULT_TOKEN_FILE_POLL_MS = 5000;
    private static final int DEFAULT_RECONNECT_MAX_RETRIES = 10;
    private static final long DEFAULT_RECONNECT_INITIAL_DELAY_MS = 1000;
    private static final long DEFAULT_RECONNECT_MAX_DELAY_MS = 60000;
    private static final long DEFAULT_SEND_TIMEOUT_MS = 2000;
    private static final long DEFAULT_PING_INTERVAL_MS = 20000;
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_METRICS_PORT = 9090;

    public FeedConfig {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (feedUri == null) {
            throw new IllegalArgumentException("feedUri cannot be null");
        }
        if (!"ws".equals(feedUri.getScheme()) && !"wss".equals(feedUri.getScheme())) {
            throw new IllegalArgumentException("feedUri must use ws or wss: " + feedUri);
        }
        if (seedTokens == null) {
            throw new IllegalArgumentException("seedTokens cannot be null");
        }
        if (tokenFilePollMs <= 0) {
            throw new IllegalArgumentException("tokenFilePollMs must be positive");
        }
        if (maxTrackedTokens < 0) {
            throw new IllegalArgumentException("maxTrackedTokens cannot be negative");
        }
        if (reconnectMaxRetries < -1) {
            throw new IllegalArgumentException("reconnectMaxRetries must be -1 or greater");
        }
        if (reconnectInitialDelayMs <= 0 || reconnectMaxDelayMs < reconnectInitialDelayMs) {
            throw new IllegalArgumentException("reconnect delays must be positive and max >= initial");
        }
        if (sendTimeoutMs <= 0) {
            throw new IllegalArgumentException("sendTimeoutMs must be positive");
        }
        if (pingIntervalMs < 0) {
            throw new IllegalArgumentException("pingIntervalMs cannot be negative");
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        seedTokens = Set.copyOf(seedTokens);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - FEED_NAME: Connection name used in logs (default: "PumpPortal")
     * - FEED_URI: Feed WebSocket URI (default: "wss://pumpportal.fun/api/data")
     * - SUBSCRIBE_NEW_TOKENS: Subscribe to new token discovery (default: true)
     * - SEED_TOKENS: Comma separated mints to track from startup (default: none)
     * - TOKEN_FILE: Token list file, one mint per line (default: disabled)
     * - TOKEN_FILE_POLL_MS: Token list poll interval (default: 5000)
     * - MAX_TRACKED_TOKENS: Cap on discovered mints (default: 0, unlimited)
     * - RECONNECT_MAX_RETRIES: Max reconnect retries (default: 10)
     * - RECONNECT_INITIAL_DELAY_MS / RECONNECT_MAX_DELAY_MS: Backoff bounds (default: 1000 / 60000)
     * - SEND_TIMEOUT_MS: Control frame write timeout (default: 2000)
     * - PING_INTERVAL_MS: Keep-alive ping interval (default: 20000)
     * - HEALTH_CHECK_MS: Health check interval (default: 5000)
     * - METRICS_PORT: Metrics HTTP port (default: 9090)
     * - WS_COMPRESSION: Negotiate permessage-deflate (default: false)
     */
    public static FeedConfig fromEnv() {
        String name = envOrDefault("FEED_NAME", DEFAULT_NAME);
        String uri = envOrDefault("FEED_URI", DEFAULT_FEED_URI);
        String tokenFile = System.getenv("TOKEN_FILE");

        return new FeedConfig(
            name,
            URI.create(uri),
            Boolean.parseBoolean(envOrDefault("SUBSCRIBE_NEW_TOKENS", "true")),
            parseTokens(System.getenv("SEED_TOKENS")),
            tokenFile == null || tokenFile.isBlank() ? null : Path.of(tokenFile.trim()),
            parseLongEnv("TOKEN_FILE_POLL_MS", DEFAULT_TOKEN_FILE_POLL_MS),
            (int) parseLongEnv("MAX_TRACKED_TOKENS", 0),
            (int) parseLongEnv("RECONNECT_MAX_RETRIES", DEFAULT_RECONNECT_MAX_RETRIES),
            parseLongEnv("RECONNECT_INITIAL_DELAY_MS", DEFAULT_RECONNECT_INITIAL_DELAY_MS),
            parseLongEnv("RECONNECT_MAX_DELAY_MS", DEFAULT_RECONNECT_MAX_DELAY_MS),
            parseLongEnv("SEND_TIMEOUT_MS", DEFAULT_SEND_TIMEOUT_MS),
            parseLongEnv("PING_INTERVAL_MS", DEFAULT_PING_INTERVAL_MS),
            (int) parseLongEnv("HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS),
            (int) parseLongEnv("METRICS_PORT", DEFAULT_METRICS_PORT),
            Boolean.parseBoolean(envOrDefault("WS_COMPRESSION", "false"))
        );
    }

    /**
     * Parses a comma separated token list. Blank entries are skipped, order is kept.
     */
    public static Set<String> parseTokens(String value) {
        Set<String> tokens = new LinkedHashSet<>();
        if (value == null || value.isBlank()) {
            return tokens;
        }
        for (String part : value.split(",")) {
            String token = part.trim();
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        return value;
    }

    private static long parseLongEnv(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + key + " value: " + value + ", using default: " + defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for FeedConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FeedConfig.
     */
    public static class Builder {
        private String name = DEFAULT_NAME;
        private URI feedUri = URI.create(DEFAULT_FEED_URI);
        private boolean subscribeNewTokens = true;
        private final Set<String> seedTokens = new LinkedHashSet<>();
        private Path tokenFile;
        private long tokenFilePollMs = DEFAULT_TOKEN_FILE_POLL_MS;
        private int maxTrackedTokens = 0;
        private int reconnectMaxRetries = DEFAULT_RECONNECT_MAX_RETRIES;
        private long reconnectInitialDelayMs = DEFAULT_RECONNECT_INITIAL_DELAY_MS;
        private long reconnectMaxDelayMs = DEFAULT_RECONNECT_MAX_DELAY_MS;
        private long sendTimeoutMs = DEFAULT_SEND_TIMEOUT_MS;
        private long pingIntervalMs = DEFAULT_PING_INTERVAL_MS;
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private boolean compression = false;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder feedUri(String feedUri) {
            this.feedUri = URI.create(feedUri);
            return this;
        }

        public Builder subscribeNewTokens(boolean subscribeNewTokens) {
            this.subscribeNewTokens = subscribeNewTokens;
            return this;
        }

        public Builder addSeedToken(String... mints) {
            this.seedTokens.addAll(java.util.Arrays.asList(mints));
            return this;
        }

        public Builder tokenFile(Path tokenFile) {
            this.tokenFile = tokenFile;
            return this;
        }

        public Builder tokenFilePollMs(long tokenFilePollMs) {
            this.tokenFilePollMs = tokenFilePollMs;
            return this;
        }

        public Builder maxTrackedTokens(int maxTrackedTokens) {
            this.maxTrackedTokens = maxTrackedTokens;
            return this;
        }

        public Builder reconnectMaxRetries(int reconnectMaxRetries) {
            this.reconnectMaxRetries = reconnectMaxRetries;
            return this;
        }

        public Builder reconnectDelays(long initialDelayMs, long maxDelayMs) {
            this.reconnectInitialDelayMs = initialDelayMs;
            this.reconnectMaxDelayMs = maxDelayMs;
            return this;
        }

        public Builder sendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
            return this;
        }

        public Builder pingIntervalMs(long pingIntervalMs) {
            this.pingIntervalMs = pingIntervalMs;
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public Builder compression(boolean compression) {
            this.compression = compression;
            return this;
        }

        public FeedConfig build() {
            return new FeedConfig(
                name,
                feedUri,
                subscribeNewTokens,
                seedTokens,
                tokenFile,
                tokenFilePollMs,
                maxTrackedTokens,
                reconnectMaxRetries,
                reconnectInitialDelayMs,
                reconnectMaxDelayMs,
                sendTimeoutMs,
                pingIntervalMs,
                healthCheckMs,
                metricsPort,
                compression
            );
        }
    }
}
