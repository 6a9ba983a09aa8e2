package com.sandkev.ledgersync.normalize;

import com.sandkev.ledgersync.domain.CanonicalTx;

/** Result of mapping one raw record: a canonical record, or the reason it was dropped. */
public record NormalizeOutcome(CanonicalTx tx, String dropReason) {

    public static NormalizeOutcome mapped(CanonicalTx tx) {
        return new NormalizeOutcome(tx, null);
    }

    public static NormalizeOutcome dropped(String reason) {
        return new NormalizeOutcome(null, reason);
    }

    public boolean isMapped() { return tx != null; }
}
