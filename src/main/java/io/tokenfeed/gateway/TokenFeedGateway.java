package io.tokenfeed.gateway;

import io.tokenfeed.gateway.config.FeedConfig;
import io.tokenfeed.gateway.core.FeedController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Token Feed Gateway application.
 */
public class TokenFeedGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenFeedGateway.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Token Feed Gateway Starting...");
        LOGGER.info("========================================");

        boolean feedLost = false;
        try {
            // Load configuration from environment variables
            FeedConfig config = FeedConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Feed: {} ({})", config.name(), config.feedUri());
            LOGGER.info("  New token discovery: {}", config.subscribeNewTokens());
            LOGGER.info("  Seed tokens: {}", config.seedTokens().size());
            LOGGER.info("  Token file: {}", config.tokenFile() != null ? config.tokenFile() : "none");
            LOGGER.info("  Max tracked tokens: {}", config.maxTrackedTokens() > 0 ? config.maxTrackedTokens() : "unlimited");

            FeedController controller = new FeedController(config);

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.start();

            // Wait for shutdown signal or loss of the feed
            controller.waitForShutdown();

            feedLost = controller.isFeedLost();
            controller.logStatus();
            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Token Feed Gateway", e);
            System.exit(1);
        }

        if (feedLost) {
            LOGGER.error("Token Feed Gateway exited after losing the feed");
            System.exit(2);
        }
        LOGGER.info("Token Feed Gateway exited");
    }
}
