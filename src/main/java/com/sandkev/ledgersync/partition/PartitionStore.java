package com.sandkev.ledgersync.partition;

import com.sandkev.ledgersync.domain.CanonicalTx;

import java.util.List;
import java.util.Optional;

/** Durable partition artifacts. Writes replace the whole partition. */
public interface PartitionStore {

    /** Empty when the partition does not exist yet. */
    Optional<List<CanonicalTx>> read(PartitionKey key);

    void write(PartitionKey key, List<CanonicalTx> rows);
}
