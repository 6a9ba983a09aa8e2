package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.domain.TxAction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static com.sandkev.ledgersync.normalize.RawPayloads.abs;
import static com.sandkev.ledgersync.normalize.RawPayloads.blank;
import static com.sandkev.ledgersync.normalize.RawPayloads.trimToNull;

/**
 * Indexed on-chain transactions. The action is inferred from the declared legs, in order:
 * <ol>
 *   <li>outgoing and incoming legs in different assets: {@code swap}, keyed on the first outgoing leg</li>
 *   <li>an approval grant: {@code approve} of the granted quantity to the spender</li>
 *   <li>outgoing legs: {@code send} ({@code deposit} when the category hint says so)</li>
 *   <li>incoming legs: {@code receive}</li>
 *   <li>nothing: {@code unknown} with a zero amount</li>
 * </ol>
 * A leg whose other end is another owned address becomes {@code transfer-out}/{@code transfer-in}.
 * Only the first leg of each side is recorded; extra legs of a multi-leg swap are not split out.
 */
@Component
public class OnchainTxNormalizer implements SourceNormalizer<RawOnchainTx> {

    private final ObjectMapper om;

    public OnchainTxNormalizer(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public NormalizeOutcome normalize(RawOnchainTx tx, SourceStream stream, RunContext run) {
        if (blank(tx.id())) return NormalizeOutcome.dropped("missing tx hash");

        Instant ts;
        try {
            ts = Timestamps.toUtc(tx.timeAt());
        } catch (IllegalArgumentException e) {
            return NormalizeOutcome.dropped(e.getMessage());
        }

        String chain = !blank(tx.chain()) ? tx.chain().trim().toLowerCase(Locale.ROOT) : stream.chain();
        String owner = stream.account();

        CanonicalTx.CanonicalTxBuilder b = CanonicalTx.builder()
                .domain(Domain.ONCHAIN)
                .source(stream.sourceId())
                .occurredAt(ts)
                .externalId(tx.id().trim())
                .logIndex(0)
                .chain(chain)
                .quoteAsset("")
                .rawPayload(RawPayloads.toJson(om, tx));

        if (tx.gasFee() != null && tx.gasFee().signum() != 0 && owner.equalsIgnoreCase(nz(tx.fromAddr()))) {
            b.feeAsset(WellKnownTokens.nativeSymbol(chain)).feeAmount(abs(tx.gasFee()));
        }

        List<TokenLeg> sends = tx.sends();
        List<TokenLeg> receives = tx.receives();

        if (!sends.isEmpty() && !receives.isEmpty() && differentAssets(sends, receives)) {
            TokenLeg out = sends.get(0);
            // no receive leg in another token: the quote side is unknown
            String quote = receives.stream()
                    .filter(r -> !sameToken(r.tokenId(), out.tokenId()))
                    .findFirst()
                    .map(in -> run.token(chain, in.tokenId()).symbol())
                    .orElse("");
            return NormalizeOutcome.mapped(b
                    .action(TxAction.SWAP)
                    .baseAsset(run.token(chain, out.tokenId()).symbol())
                    .quoteAsset(quote)
                    .amount(amountOf(out))
                    .counterpartyFrom(owner)
                    .counterpartyTo(firstNonBlank(out.counterparty(), tx.toAddr()))
                    .build());
        }

        if (tx.approval() != null) {
            TokenApproval a = tx.approval();
            return NormalizeOutcome.mapped(b
                    .action(TxAction.APPROVE)
                    .baseAsset(run.token(chain, a.tokenId()).symbol())
                    .amount(a.value() == null ? BigDecimal.ZERO : a.value().abs())
                    .counterpartyFrom(owner)
                    .counterpartyTo(trimToNull(a.spender()))
                    .build());
        }

        if (!sends.isEmpty()) {
            TokenLeg out = sends.get(0);
            TxAction action;
            if ("deposit".equalsIgnoreCase(nz(tx.categoryHint()).trim())) {
                action = TxAction.DEPOSIT;
            } else if (isOtherOwned(stream, out.counterparty())) {
                action = TxAction.TRANSFER_OUT;
            } else {
                action = TxAction.SEND;
            }
            return NormalizeOutcome.mapped(b
                    .action(action)
                    .baseAsset(run.token(chain, out.tokenId()).symbol())
                    .amount(amountOf(out))
                    .counterpartyFrom(owner)
                    .counterpartyTo(firstNonBlank(out.counterparty(), tx.toAddr()))
                    .build());
        }

        if (!receives.isEmpty()) {
            TokenLeg in = receives.get(0);
            return NormalizeOutcome.mapped(b
                    .action(isOtherOwned(stream, in.counterparty()) ? TxAction.TRANSFER_IN : TxAction.RECEIVE)
                    .baseAsset(run.token(chain, in.tokenId()).symbol())
                    .amount(amountOf(in))
                    .counterpartyFrom(firstNonBlank(in.counterparty(), tx.fromAddr()))
                    .counterpartyTo(owner)
                    .build());
        }

        // kept for auditability even though nothing moved
        return NormalizeOutcome.mapped(b
                .action(TxAction.UNKNOWN)
                .baseAsset("")
                .amount(BigDecimal.ZERO)
                .counterpartyFrom(trimToNull(tx.fromAddr()))
                .counterpartyTo(trimToNull(tx.toAddr()))
                .build());
    }

    private static boolean differentAssets(List<TokenLeg> sends, List<TokenLeg> receives) {
        return !tokenIds(sends).equals(tokenIds(receives));
    }

    private static Set<String> tokenIds(List<TokenLeg> legs) {
        return legs.stream()
                .map(TokenLeg::tokenId)
                .filter(Objects::nonNull)
                .map(id -> id.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static boolean sameToken(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }

    private static BigDecimal amountOf(TokenLeg leg) {
        return leg.amount() == null ? BigDecimal.ZERO : leg.amount().abs();
    }

    static boolean isOtherOwned(SourceStream stream, String address) {
        return stream.owns(address) && !address.trim().equalsIgnoreCase(stream.account());
    }

    private static String firstNonBlank(String a, String b) {
        return !blank(a) ? a.trim() : trimToNull(b);
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
