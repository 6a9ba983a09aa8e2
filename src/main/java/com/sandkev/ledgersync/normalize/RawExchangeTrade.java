package com.sandkev.ledgersync.normalize;

import java.math.BigDecimal;

/** Unified exchange trade (CCXT shape): symbol is {@code BASE/QUOTE}, timestamp in millis. */
public record RawExchangeTrade(
        String id,
        String order,
        Object timestamp,
        String symbol,
        String side,
        BigDecimal amount,
        BigDecimal price,
        String feeCurrency,
        BigDecimal feeCost
) implements RawRecord {

    @Override
    public String sourceRef() { return id; }
}
