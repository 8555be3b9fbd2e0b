package io.tokenfeed.gateway.core;

import io.tokenfeed.gateway.dispatch.FeedEventHandler;
import io.tokenfeed.gateway.model.SubscriptionKind;
import io.tokenfeed.gateway.model.TokenCreatedEvent;
import io.tokenfeed.gateway.subscription.SubscriptionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscribes to the trades of every newly created token.
 * A mint that is already desired is ignored, so repeated discoveries send nothing.
 */
public class DiscoveryBridge implements FeedEventHandler<TokenCreatedEvent> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryBridge.class);

    private final SubscriptionManager subscriptions;
    private final int maxTrackedTokens;

    /**
     * @param subscriptions    Subscription manager owning the token-trade set
     * @param maxTrackedTokens Cap on the token-trade desired set (0 for unlimited)
     */
    public DiscoveryBridge(SubscriptionManager subscriptions, int maxTrackedTokens) {
        this.subscriptions = subscriptions;
        this.maxTrackedTokens = maxTrackedTokens;
    }

    @Override
    public void onEvent(TokenCreatedEvent event) {
        if (!subscriptions.addDesiredWithin(SubscriptionKind.TOKEN_TRADE, event.mint(), maxTrackedTokens)) {
            LOGGER.debug("Mint {} already tracked or over limit", event.mint());
            return;
        }
        LOGGER.info("[New Token] {} ({}) - Mint: {}. Subscribing to trades.",
            event.name(), event.symbol(), event.mint());
        subscriptions.reconcile(SubscriptionKind.TOKEN_TRADE);
    }
}
