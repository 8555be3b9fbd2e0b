package io.tokenfeed.gateway.core;

import io.prometheus.client.CollectorRegistry;
import io.tokenfeed.gateway.metrics.FeedMetrics;
import io.tokenfeed.gateway.model.SubscriptionKind;
import io.tokenfeed.gateway.model.TokenCreatedEvent;
import io.tokenfeed.gateway.subscription.ControlFrameEncoder;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DiscoveryBridge.
 */
class DiscoveryBridgeTest {

    private final List<String> sent = new ArrayList<>();
    private SubscriptionManager subscriptions;

    @BeforeEach
    void setUp() {
        subscriptions = new SubscriptionManager(sent::add, new ControlFrameEncoder(), new FeedMetrics(new CollectorRegistry()));
    }

    @Test
    void testNewTokenSubscribesToItsTrades() {
        DiscoveryBridge bridge = new DiscoveryBridge(subscriptions, 0);

        bridge.onEvent(created("MINT_A"));

        assertEquals(List.of("{\"method\":\"subscribeTokenTrade\",\"keys\":[\"MINT_A\"]}"), sent);
        assertEquals(Set.of("MINT_A"), subscriptions.active(SubscriptionKind.TOKEN_TRADE));
    }

    @Test
    void testRepeatedDiscoverySendsOnce() {
        DiscoveryBridge bridge = new DiscoveryBridge(subscriptions, 0);

        bridge.onEvent(created("MINT_A"));
        bridge.onEvent(created("MINT_A"));

        assertEquals(1, sent.size());
        assertEquals(1, subscriptions.desiredCount(SubscriptionKind.TOKEN_TRADE));
    }

    @Test
    void testAlreadyTrackedMintSendsNothing() {
        subscriptions.addDesired(SubscriptionKind.TOKEN_TRADE, "MINT_A");
        subscriptions.reconcile(SubscriptionKind.TOKEN_TRADE);
        sent.clear();

        new DiscoveryBridge(subscriptions, 0).onEvent(created("MINT_A"));

        assertTrue(sent.isEmpty());
    }

    @Test
    void testLimitStopsTracking() {
        DiscoveryBridge bridge = new DiscoveryBridge(subscriptions, 2);

        bridge.onEvent(created("MINT_A"));
        bridge.onEvent(created("MINT_B"));
        bridge.onEvent(created("MINT_C"));

        assertEquals(2, sent.size());
        assertEquals(Set.of("MINT_A", "MINT_B"), subscriptions.desired(SubscriptionKind.TOKEN_TRADE));
    }

    private static TokenCreatedEvent created(String mint) {
        return new TokenCreatedEvent(mint, "Token " + mint, "TKN", "sig", "creator", null, 1L);
    }
}
