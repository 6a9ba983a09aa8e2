package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.normalize.RawTokenTransferLog;

import java.util.Optional;

/**
 * Supplies ERC-20 transfer log fetchers per (chain, address). An empty optional means no
 * log source exists for that pair and no stream is built.
 */
public interface TokenLogFetchers {

    Optional<BatchFetcher<RawTokenTransferLog>> transferLogs(String chain, String address);

    static TokenLogFetchers none() {
        return (chain, address) -> Optional.empty();
    }
}
