package com.sandkev.ledgersync.store;

/** Rows written and rows rejected by validation for one upsert call. */
public record UpsertReport(int upserted, int skipped) {

    public static final UpsertReport EMPTY = new UpsertReport(0, 0);

    public UpsertReport plus(UpsertReport other) {
        return new UpsertReport(upserted + other.upserted, skipped + other.skipped);
    }
}
