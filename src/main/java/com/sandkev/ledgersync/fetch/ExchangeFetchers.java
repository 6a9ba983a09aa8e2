package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.domain.EntityKind;
import com.sandkev.ledgersync.normalize.RawExchangeTrade;
import com.sandkev.ledgersync.normalize.RawExchangeTransfer;

import java.util.Optional;

/**
 * Supplies fetch collaborators for exchange accounts. An empty optional means the
 * exchange/account is not available (no credentials, unsupported exchange) and the
 * stream is skipped.
 */
public interface ExchangeFetchers {

    Optional<BatchFetcher<RawExchangeTrade>> trades(String exchange, String account);

    /** Deposits or withdrawals, selected by {@code kind}. */
    Optional<BatchFetcher<RawExchangeTransfer>> transfers(String exchange, EntityKind kind, String account);

    static ExchangeFetchers none() {
        return new ExchangeFetchers() {
            @Override
            public Optional<BatchFetcher<RawExchangeTrade>> trades(String exchange, String account) {
                return Optional.empty();
            }

            @Override
            public Optional<BatchFetcher<RawExchangeTransfer>> transfers(String exchange, EntityKind kind, String account) {
                return Optional.empty();
            }
        };
    }
}
