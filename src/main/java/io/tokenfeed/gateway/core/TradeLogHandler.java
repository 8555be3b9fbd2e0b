package io.tokenfeed.gateway.core;

import io.tokenfeed.gateway.model.TokenCreatedEvent;
import io.tokenfeed.gateway.model.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default consumer that writes created tokens and trades to the log.
 */
public class TradeLogHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(TradeLogHandler.class);

    private final AtomicLong createdCount = new AtomicLong(0);
    private final AtomicLong tradeCount = new AtomicLong(0);

    public void onCreated(TokenCreatedEvent event) {
        createdCount.incrementAndGet();
        LOGGER.info("[Created] {} ({}) mint={} marketCapSol={}",
            event.name(), event.symbol(), event.mint(), event.marketCapSol());
    }

    public void onTrade(TradeEvent trade) {
        tradeCount.incrementAndGet();
        LOGGER.info("[Trade] {} {} SOL on {} by {} (Tracking {} tokens)",
            trade.side(),
            trade.solAmount().toPlainString(),
            trade.mint(),
            trade.traderPublicKey(),
            trade.trackedCountAtEvent()
        );
    }

    public long getCreatedCount() {
        return createdCount.get();
    }

    public long getTradeCount() {
        return tradeCount.get();
    }
}
