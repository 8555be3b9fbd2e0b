package io.tokenfeed.gateway.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedConfig.
 */
class FeedConfigTest {

    @Test
    void testBuilderDefaults() {
        FeedConfig config = FeedConfig.builder().build();

        assertEquals("PumpPortal", config.name());
        assertEquals(FeedConfig.DEFAULT_FEED_URI, config.feedUri().toString());
        assertTrue(config.subscribeNewTokens());
        assertTrue(config.seedTokens().isEmpty());
        assertNull(config.tokenFile());
        assertEquals(0, config.maxTrackedTokens());
        assertEquals(10, config.reconnectMaxRetries());
        assertEquals(1000, config.reconnectInitialDelayMs());
        assertEquals(60000, config.reconnectMaxDelayMs());
        assertEquals(9090, config.metricsPort());
        assertFalse(config.compression());
    }

    @Test
    void testSeedTokensAreImmutable() {
        FeedConfig config = FeedConfig.builder().addSeedToken("MINT_A", "MINT_B").build();

        assertEquals(Set.of("MINT_A", "MINT_B"), config.seedTokens());
        assertThrows(UnsupportedOperationException.class, () -> config.seedTokens().add("MINT_C"));
    }

    @Test
    void testRejectsNonWebSocketUri() {
        assertThrows(IllegalArgumentException.class,
            () -> FeedConfig.builder().feedUri("https://pumpportal.fun/api/data").build());
    }

    @Test
    void testAcceptsPlainWebSocketUri() {
        FeedConfig config = FeedConfig.builder().feedUri("ws://localhost:8080/feed").build();
        assertEquals("ws", config.feedUri().getScheme());
    }

    @Test
    void testRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder().reconnectMaxRetries(-2).build());
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder().reconnectDelays(1000, 500).build());
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder().maxTrackedTokens(-1).build());
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder().metricsPort(70000).build());
        assertThrows(IllegalArgumentException.class, () -> FeedConfig.builder().name("").build());
    }

    @Test
    void testUnlimitedRetriesAllowed() {
        assertEquals(-1, FeedConfig.builder().reconnectMaxRetries(-1).build().reconnectMaxRetries());
    }

    @Test
    void testParseTokens() {
        assertEquals(List.of("MINT_A", "MINT_B"), List.copyOf(FeedConfig.parseTokens(" MINT_A, ,MINT_B,MINT_A ")));
        assertTrue(FeedConfig.parseTokens(null).isEmpty());
        assertTrue(FeedConfig.parseTokens("  ").isEmpty());
    }
}
