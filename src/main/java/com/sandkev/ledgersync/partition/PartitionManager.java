package com.sandkev.ledgersync.partition;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.EntityKind;
import com.sandkev.ledgersync.domain.NaturalKey;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.store.StagedTxStore;
import lombok.extern.slf4j.Slf4j;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups canonical records by calendar month (UTC) and merges them into the matching
 * partition: existing rows plus new rows, new rows replacing existing ones with the same
 * natural key. Merges on the same partition are serialized through a fixed set of lock stripes.
 */
@Slf4j
public class PartitionManager {

    static final Comparator<CanonicalTx> ORDER = Comparator.comparing(CanonicalTx::occurredAt)
            .thenComparing(CanonicalTx::externalId)
            .thenComparingInt(CanonicalTx::logIndex);

    static final int LOCK_STRIPES = 64;

    private final PartitionStore store;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public PartitionManager(PartitionStore store) {
        this.store = store;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    Object lockFor(PartitionKey key) {
        return locks[Math.floorMod(key.hashCode(), locks.length)];
    }

    public MergeReport merge(SourceStream stream, List<CanonicalTx> records) {
        if (records.isEmpty()) return MergeReport.EMPTY;
        Map<YearMonth, List<CanonicalTx>> byMonth = records.stream()
                .collect(Collectors.groupingBy(CanonicalTx::period, TreeMap::new, Collectors.toList()));

        MergeReport report = MergeReport.EMPTY;
        for (var e : byMonth.entrySet()) {
            var key = new PartitionKey(stream.domain(), stream.sourceId(), stream.entity(), e.getKey());
            report = report.plus(mergeOne(key, e.getValue()));
        }
        return report;
    }

    private MergeReport mergeOne(PartitionKey key, List<CanonicalTx> incoming) {
        synchronized (lockFor(key)) {
            var existing = store.read(key);
            Map<NaturalKey, CanonicalTx> rows = new LinkedHashMap<>();
            existing.ifPresent(list -> list.forEach(r -> rows.put(r.naturalKey(), r)));
            int before = rows.size();
            incoming.forEach(r -> rows.put(r.naturalKey(), r));

            List<CanonicalTx> merged = new ArrayList<>(rows.values());
            merged.sort(ORDER);
            store.write(key, merged);

            log.debug("Partition {}: {} existing + {} incoming -> {}", key, before, incoming.size(), merged.size());
            return new MergeReport(1, existing.isPresent() ? 0 : 1, merged.size() - before, merged.size());
        }
    }

    /**
     * Re-derives every partition of {@code domain} from the staged table, replacing the files.
     * Partitions with no rows in the store are left alone.
     */
    public int rebuildFromStore(StagedTxStore staged, Domain domain) {
        Map<PartitionKey, List<CanonicalTx>> grouped = new TreeMap<>(Comparator.comparing(PartitionKey::toString));
        for (CanonicalTx tx : staged.findAll(domain)) {
            var key = new PartitionKey(domain, tx.source(), EntityKind.of(domain, tx.action()), tx.period());
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(tx);
        }
        grouped.forEach((key, rows) -> {
            synchronized (lockFor(key)) {
                rows.sort(ORDER);
                store.write(key, rows);
            }
        });
        log.info("Rebuilt {} {} partition(s) from the store", grouped.size(), domain.code());
        return grouped.size();
    }
}
