package com.sandkev.ledgersync.normalize;

import java.math.BigDecimal;

/**
 * Exchange deposit or withdrawal. Direction is not part of the record; it comes from the
 * stream that fetched it.
 */
public record RawExchangeTransfer(
        String id,
        String txid,
        Object timestamp,
        String currency,
        BigDecimal amount,
        String address,
        String tag,
        String status,
        String feeCurrency,
        BigDecimal feeCost
) implements RawRecord {

    @Override
    public String sourceRef() { return id != null ? id : txid; }

    public RawExchangeTransfer withCurrency(String probed) {
        return new RawExchangeTransfer(id, txid, timestamp, probed, amount, address, tag, status, feeCurrency, feeCost);
    }
}
