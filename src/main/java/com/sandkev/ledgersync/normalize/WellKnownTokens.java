package com.sandkev.ledgersync.normalize;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static metadata for the most common assets, checked before any lookup.
 * Native assets are keyed by the chain id itself, the way the history feed reports them.
 */
public final class WellKnownTokens {

    private static final Map<String, TokenMeta> NATIVE = Map.of(
            "eth", TokenMeta.of("ETH", 18),
            "arb", TokenMeta.of("ETH", 18),
            "op", TokenMeta.of("ETH", 18),
            "base", TokenMeta.of("ETH", 18),
            "bsc", TokenMeta.of("BNB", 18),
            "matic", TokenMeta.of("POL", 18),
            "avax", TokenMeta.of("AVAX", 18),
            "ftm", TokenMeta.of("FTM", 18)
    );

    private static final Map<String, TokenMeta> ETH_CONTRACTS = Map.of(
            "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48", TokenMeta.of("USDC", 6),
            "0xdac17f958d2ee523a2206206994597c13d831ec7", TokenMeta.of("USDT", 6),
            "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2", TokenMeta.of("WETH", 18),
            "0x6b175474e89094c44da98b954eedeac495271d0f", TokenMeta.of("DAI", 18),
            "0x2260fac5e5542a773aa44fbcfedf7c193bc2c599", TokenMeta.of("WBTC", 8),
            "0x514910771af9ca656af840dff83e8264ecf986ca", TokenMeta.of("LINK", 18)
    );

    private WellKnownTokens() {}

    public static Optional<TokenMeta> lookup(String chain, String assetId) {
        if (assetId == null || assetId.isBlank()) return Optional.empty();
        String id = assetId.trim().toLowerCase(Locale.ROOT);
        String c = chain == null ? "" : chain.trim().toLowerCase(Locale.ROOT);
        if (id.equals(c) && NATIVE.containsKey(c)) return Optional.of(NATIVE.get(c));
        if ("eth".equals(c)) return Optional.ofNullable(ETH_CONTRACTS.get(id));
        return Optional.empty();
    }

    /** Symbol of the chain's gas asset; falls back to the upper-cased chain id. */
    public static String nativeSymbol(String chain) {
        String c = chain == null ? "" : chain.trim().toLowerCase(Locale.ROOT);
        TokenMeta meta = NATIVE.get(c);
        return meta != null ? meta.symbol() : c.toUpperCase(Locale.ROOT);
    }
}
