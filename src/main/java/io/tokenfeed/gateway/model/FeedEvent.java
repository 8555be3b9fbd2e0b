package io.tokenfeed.gateway.model;

/**
 * An event classified from an inbound feed frame.
 * Implementations are immutable records.
 */
public interface FeedEvent {

    /**
     * Variant of this event.
     */
    EventType type();

    /**
     * Mint address the event refers to.
     */
    String mint();

    /**
     * Event timestamp in milliseconds.
     */
    long timestamp();
}
