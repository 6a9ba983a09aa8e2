package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.domain.TxAction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

import static com.sandkev.ledgersync.normalize.RawPayloads.blank;

/**
 * Raw ERC-20 Transfer logs. Symbol and decimals come from the run context; the raw integer
 * value is scaled by the token's decimals before it is stored.
 */
@Component
public class TokenTransferLogNormalizer implements SourceNormalizer<RawTokenTransferLog> {

    private final ObjectMapper om;

    public TokenTransferLogNormalizer(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public NormalizeOutcome normalize(RawTokenTransferLog transfer, SourceStream stream, RunContext run) {
        if (blank(transfer.txHash())) return NormalizeOutcome.dropped("missing tx hash");
        if (transfer.value() == null) return NormalizeOutcome.dropped("missing value");
        if (transfer.logIndex() != null && transfer.logIndex() < 0) return NormalizeOutcome.dropped("negative log index");

        Instant ts;
        try {
            ts = Timestamps.toUtc(transfer.blockTimestamp());
        } catch (IllegalArgumentException e) {
            return NormalizeOutcome.dropped(e.getMessage());
        }

        TokenMeta meta = run.token(stream.chain(), transfer.contractAddress());
        BigDecimal amount = new BigDecimal(transfer.value().abs()).movePointLeft(meta.decimals()).stripTrailingZeros();

        String owner = stream.account();
        TxAction action;
        if (owner.equalsIgnoreCase(transfer.from())) {
            action = OnchainTxNormalizer.isOtherOwned(stream, transfer.to()) ? TxAction.TRANSFER_OUT : TxAction.SEND;
        } else if (owner.equalsIgnoreCase(transfer.to())) {
            action = OnchainTxNormalizer.isOtherOwned(stream, transfer.from()) ? TxAction.TRANSFER_IN : TxAction.RECEIVE;
        } else {
            action = TxAction.UNKNOWN;
        }

        return NormalizeOutcome.mapped(CanonicalTx.builder()
                .domain(Domain.ONCHAIN)
                .source(stream.sourceId())
                .occurredAt(ts)
                .externalId(transfer.txHash().trim())
                .logIndex(transfer.logIndex() == null ? 0 : transfer.logIndex())
                .baseAsset(meta.symbol())
                .quoteAsset("")
                .action(action)
                .amount(amount)
                .counterpartyFrom(transfer.from())
                .counterpartyTo(transfer.to())
                .chain(stream.chain())
                .rawPayload(RawPayloads.toJson(om, transfer))
                .build());
    }
}
