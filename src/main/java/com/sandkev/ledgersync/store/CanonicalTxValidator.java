package com.sandkev.ledgersync.store;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.TxAction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/** Structural checks a record must pass before it reaches the store. */
@Component
public class CanonicalTxValidator {

    /** @return the first violation, empty when the record is storable */
    public Optional<String> violation(CanonicalTx tx) {
        if (tx.domain() == null) return Optional.of("missing domain");
        if (blank(tx.source())) return Optional.of("missing source");
        if (blank(tx.externalId())) return Optional.of("missing external_id");
        if (tx.logIndex() < 0) return Optional.of("negative log_index");
        if (tx.occurredAt() == null) return Optional.of("missing occurred_at");
        if (tx.action() == null) return Optional.of("missing action");
        if (tx.amount() == null) return Optional.of("missing amount");
        if (tx.amount().signum() < 0) return Optional.of("negative amount");
        if (tx.feeAmount() != null && tx.feeAmount().compareTo(BigDecimal.ZERO) < 0) return Optional.of("negative fee");
        if (tx.action() != TxAction.UNKNOWN && blank(tx.baseAsset())) return Optional.of("missing base_asset");
        if (tx.domain() == Domain.ONCHAIN && blank(tx.chain())) return Optional.of("on-chain record without chain");
        if (tx.domain() == Domain.EXCHANGE && !blank(tx.chain())) return Optional.of("exchange record with chain");
        return Optional.empty();
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
