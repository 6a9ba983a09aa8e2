package com.sandkev.ledgersync.normalize;

import java.util.Optional;

/** Looks up symbol/decimals for an asset identifier on a chain (e.g. a token API). */
@FunctionalInterface
public interface TokenMetadataResolver {

    Optional<TokenMeta> resolve(String chain, String assetId);

    static TokenMetadataResolver none() {
        return (chain, assetId) -> Optional.empty();
    }
}
