package com.sandkev.ledgersync.normalize;

/**
 * Source-family shape of one upstream record, before normalization.
 * Absent upstream fields are null; each normalizer documents the default it applies.
 */
public sealed interface RawRecord
        permits RawExchangeTrade, RawExchangeTransfer, RawOnchainTx, RawTokenTransferLog {

    /** Upstream identifier used in log lines about this record; may be null. */
    String sourceRef();
}
