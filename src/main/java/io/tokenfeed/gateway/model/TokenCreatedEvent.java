package io.tokenfeed.gateway.model;

import java.math.BigDecimal;

/**
 * A new token was created on the feed.
 *
 * @param mint            Mint address of the new token
 * @param name            Token name (may be null)
 * @param symbol          Token symbol (may be null)
 * @param signature       Creation transaction signature (may be null)
 * @param traderPublicKey Creator public key (may be null)
 * @param marketCapSol    Initial market cap in SOL (may be null)
 * @param timestamp       Event timestamp in milliseconds
 */
public record TokenCreatedEvent(
    String mint,
    String name,
    String symbol,
    String signature,
    String traderPublicKey,
    BigDecimal marketCapSol,
    long timestamp
) implements FeedEvent {
    public TokenCreatedEvent {
        if (mint == null || mint.isEmpty()) {
            throw new IllegalArgumentException("mint cannot be null or empty");
        }
    }

    @Override
    public EventType type() {
        return EventType.CREATED;
    }
}
