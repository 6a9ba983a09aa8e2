package com.sandkev.ledgersync.partition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.TxAction;

import java.math.BigDecimal;
import java.time.Instant;

/** Flat CSV shape of a canonical record. */
@JsonPropertyOrder({"domain", "source", "occurred_at", "external_id", "log_index", "base_asset", "quote_asset",
        "action", "amount", "price", "fee_asset", "fee_amount", "counterparty_from", "counterparty_to",
        "chain", "raw_payload", "year", "month"})
public record PartitionRow(
        @JsonProperty("domain") String domain,
        @JsonProperty("source") String source,
        @JsonProperty("occurred_at") String occurredAt,
        @JsonProperty("external_id") String externalId,
        @JsonProperty("log_index") Integer logIndex,
        @JsonProperty("base_asset") String baseAsset,
        @JsonProperty("quote_asset") String quoteAsset,
        @JsonProperty("action") String action,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("price") BigDecimal price,
        @JsonProperty("fee_asset") String feeAsset,
        @JsonProperty("fee_amount") BigDecimal feeAmount,
        @JsonProperty("counterparty_from") String counterpartyFrom,
        @JsonProperty("counterparty_to") String counterpartyTo,
        @JsonProperty("chain") String chain,
        @JsonProperty("raw_payload") String rawPayload,
        @JsonProperty("year") Integer year,
        @JsonProperty("month") Integer month
) {

    static PartitionRow of(CanonicalTx tx) {
        return new PartitionRow(tx.domain().code(), tx.source(), tx.occurredAt().toString(), tx.externalId(),
                tx.logIndex(), tx.baseAsset(), tx.quoteAsset(), tx.action().code(), tx.amount(), tx.price(),
                tx.feeAsset(), tx.feeAmount(), tx.counterpartyFrom(), tx.counterpartyTo(), tx.chain(),
                tx.rawPayload(), tx.year(), tx.month());
    }

    CanonicalTx toCanonical() {
        return CanonicalTx.builder()
                .domain(Domain.fromCode(domain))
                .source(source)
                .occurredAt(Instant.parse(occurredAt))
                .externalId(externalId)
                .logIndex(logIndex == null ? 0 : logIndex)
                .baseAsset(baseAsset == null ? "" : baseAsset)
                .quoteAsset(quoteAsset)
                .action(TxAction.fromCode(action))
                .amount(amount)
                .price(price)
                .feeAsset(feeAsset)
                .feeAmount(feeAmount)
                .counterpartyFrom(counterpartyFrom)
                .counterpartyTo(counterpartyTo)
                .chain(chain)
                .rawPayload(rawPayload)
                .build();
    }
}
