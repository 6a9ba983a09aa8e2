package com.sandkev.ledgersync.normalize;

import java.math.BigDecimal;
import java.util.List;

/**
 * Indexed on-chain transaction with its decoded legs (DeBank history shape).
 * Leg amounts are already decimal-scaled.
 */
public record RawOnchainTx(
        String id,
        Object timeAt,
        String chain,
        String categoryHint,        // cate_id, nullable
        boolean scam,
        List<TokenLeg> sends,
        List<TokenLeg> receives,
        TokenApproval approval,     // nullable
        String fromAddr,
        String toAddr,
        BigDecimal gasFee           // native asset units, nullable
) implements RawRecord {

    public RawOnchainTx {
        sends = sends == null ? List.of() : List.copyOf(sends);
        receives = receives == null ? List.of() : List.copyOf(receives);
    }

    @Override
    public String sourceRef() { return id; }
}
