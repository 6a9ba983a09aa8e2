package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.domain.TxAction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

import static com.sandkev.ledgersync.normalize.RawPayloads.abs;
import static com.sandkev.ledgersync.normalize.RawPayloads.blank;
import static com.sandkev.ledgersync.normalize.RawPayloads.trimToNull;

/**
 * Exchange deposits and withdrawals. The side is fixed by the stream's entity kind;
 * transfers the exchange reports as failed or cancelled never moved funds and are dropped.
 */
@Component
public class ExchangeTransferNormalizer implements SourceNormalizer<RawExchangeTransfer> {

    private static final Set<String> VOID_STATUSES = Set.of("failed", "canceled", "cancelled", "rejected");

    private final ObjectMapper om;

    public ExchangeTransferNormalizer(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public NormalizeOutcome normalize(RawExchangeTransfer t, SourceStream stream, RunContext run) {
        TxAction action = switch (stream.entity()) {
            case DEPOSITS -> TxAction.DEPOSIT;
            case WITHDRAWALS -> TxAction.WITHDRAWAL;
            default -> null;
        };
        if (action == null) return NormalizeOutcome.dropped("not a transfer stream: " + stream.entity());

        String externalId = !blank(t.id()) ? t.id().trim() : trimToNull(t.txid());
        if (externalId == null) return NormalizeOutcome.dropped("missing transfer id");
        if (blank(t.currency())) return NormalizeOutcome.dropped("missing currency");
        if (t.amount() == null) return NormalizeOutcome.dropped("missing amount");
        if (t.status() != null && VOID_STATUSES.contains(t.status().trim().toLowerCase(Locale.ROOT))) {
            return NormalizeOutcome.dropped("status " + t.status());
        }

        Instant ts;
        try {
            ts = Timestamps.toUtc(t.timestamp());
        } catch (IllegalArgumentException e) {
            return NormalizeOutcome.dropped(e.getMessage());
        }

        return NormalizeOutcome.mapped(CanonicalTx.builder()
                .domain(Domain.EXCHANGE)
                .source(stream.sourceId())
                .occurredAt(ts)
                .externalId(externalId)
                .logIndex(0)
                .baseAsset(t.currency().trim().toUpperCase(Locale.ROOT))
                .quoteAsset("")
                .action(action)
                .amount(abs(t.amount()))
                .feeAsset(trimToNull(t.feeCurrency()))
                .feeAmount(abs(t.feeCost()))
                .counterpartyTo(trimToNull(t.address()))
                .rawPayload(RawPayloads.toJson(om, t))
                .build());
    }
}
