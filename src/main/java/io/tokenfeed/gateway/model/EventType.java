package io.tokenfeed.gateway.model;

/**
 * Variants of {@link FeedEvent}.
 */
public enum EventType {
    CREATED,
    TRADE
}
