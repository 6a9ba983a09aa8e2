package com.sandkev.ledgersync.normalize;

/** Symbol and decimals of an asset; {@code placeholder} marks values that were not resolved. */
public record TokenMeta(String symbol, int decimals, boolean placeholder) {

    public static final int DEFAULT_DECIMALS = 18;

    public static TokenMeta of(String symbol, int decimals) {
        return new TokenMeta(symbol, decimals, false);
    }

    /** Deterministic stand-in: first 8 characters of the identifier, 18 decimals. */
    public static TokenMeta placeholderFor(String assetId) {
        String id = assetId == null ? "" : assetId.trim();
        String symbol = id.length() > 8 ? id.substring(0, 8) : id;
        return new TokenMeta(symbol, DEFAULT_DECIMALS, true);
    }
}
