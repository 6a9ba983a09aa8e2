package com.sandkev.ledgersync.domain;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * One discrete economic event in the unified ledger.
 * Immutable; a re-ingested event replaces the stored row with the same {@link NaturalKey}.
 */
@Builder(toBuilder = true)
public record CanonicalTx(
        Domain domain,
        String source,
        Instant occurredAt,
        String externalId,
        int logIndex,
        String baseAsset,
        String quoteAsset,          // empty for transfers
        TxAction action,
        BigDecimal amount,          // magnitude, decimal-scaled
        BigDecimal price,           // nullable, quote per base
        String feeAsset,            // nullable
        BigDecimal feeAmount,       // nullable
        String counterpartyFrom,    // nullable
        String counterpartyTo,      // nullable
        String chain,               // on-chain only
        String rawPayload
) {

    public CanonicalTx {
        if (quoteAsset == null) quoteAsset = "";
    }

    public NaturalKey naturalKey() {
        return new NaturalKey(source, externalId, logIndex);
    }

    public YearMonth period() {
        return YearMonth.from(occurredAt.atOffset(ZoneOffset.UTC));
    }

    public int year() { return period().getYear(); }

    public int month() { return period().getMonthValue(); }
}
