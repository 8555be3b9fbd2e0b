package io.tokenfeed.gateway.model;

import java.math.BigDecimal;

/**
 * A buy or sell on a tracked token.
 *
 * @param mint                Mint address of the traded token
 * @param side                Trade side (BUY or SELL)
 * @param solAmount           SOL amount of the trade
 * @param tokenAmount         Token amount of the trade (may be null)
 * @param traderPublicKey     Trader public key (may be null)
 * @param signature           Transaction signature (may be null)
 * @param marketCapSol        Market cap in SOL after the trade (may be null)
 * @param tokensInPool        Tokens left in the bonding-curve pool after the trade (may be null)
 * @param solInPool           SOL held by the bonding-curve pool after the trade (may be null)
 * @param pool                Pool the trade executed on (may be null)
 * @param trackedCountAtEvent Number of desired token-trade topics when the trade was processed
 * @param timestamp           Event timestamp in milliseconds
 */
public record TradeEvent(
    String mint,
    Side side,
    BigDecimal solAmount,
    BigDecimal tokenAmount,
    String traderPublicKey,
    String signature,
    BigDecimal marketCapSol,
    BigDecimal tokensInPool,
    BigDecimal solInPool,
    String pool,
    int trackedCountAtEvent,
    long timestamp
) implements FeedEvent {
    public TradeEvent {
        if (mint == null || mint.isEmpty()) {
            throw new IllegalArgumentException("mint cannot be null or empty");
        }
        if (side == null || side == Side.UNKNOWN) {
            throw new IllegalArgumentException("side must be BUY or SELL");
        }
        if (solAmount == null) {
            throw new IllegalArgumentException("solAmount cannot be null");
        }
        if (trackedCountAtEvent < 0) {
            throw new IllegalArgumentException("trackedCountAtEvent cannot be negative");
        }
    }

    @Override
    public EventType type() {
        return EventType.TRADE;
    }
}
