package com.sandkev.ledgersync.unified;

/** Row count against distinct natural keys for one staged table; they match when the key invariant holds. */
public record QualityCheck(String table, long rows, long distinctKeys) {

    public long duplicates() { return rows - distinctKeys; }

    public boolean passed() { return rows == distinctKeys; }
}
