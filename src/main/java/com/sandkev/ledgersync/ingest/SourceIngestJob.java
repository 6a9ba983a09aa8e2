package com.sandkev.ledgersync.ingest;

import com.sandkev.ledgersync.config.IngestProperties;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.RunStatus;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.fetch.FetchRequest;
import com.sandkev.ledgersync.fetch.PaginationResult;
import com.sandkev.ledgersync.fetch.Paginator;
import com.sandkev.ledgersync.normalize.NormalizeOutcome;
import com.sandkev.ledgersync.normalize.RawRecord;
import com.sandkev.ledgersync.normalize.RunContext;
import com.sandkev.ledgersync.normalize.ScamFilter;
import com.sandkev.ledgersync.partition.MergeReport;
import com.sandkev.ledgersync.partition.PartitionManager;
import com.sandkev.ledgersync.store.CanonicalTxValidator;
import com.sandkev.ledgersync.store.StagedTxStore;
import com.sandkev.ledgersync.store.UpsertReport;
import com.sandkev.ledgersync.sync.SyncStateTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one stream end to end: watermark, paginated fetch, scam filter, normalize, validate,
 * then per page upsert into the store and merge into partitions, and finally record the outcome.
 * Each page is persisted before the next is fetched.
 */
@Slf4j
@Service
public class SourceIngestJob {

    private final SyncStateTracker tracker;
    private final Paginator paginator;
    private final ScamFilter scamFilter;
    private final CanonicalTxValidator validator;
    private final StagedTxStore store;
    private final Optional<PartitionManager> partitions;
    private final IngestProperties props;

    public SourceIngestJob(SyncStateTracker tracker,
                           Paginator paginator,
                           ScamFilter scamFilter,
                           CanonicalTxValidator validator,
                           StagedTxStore store,
                           Optional<PartitionManager> partitions,
                           IngestProperties props) {
        this.tracker = tracker;
        this.paginator = paginator;
        this.scamFilter = scamFilter;
        this.validator = validator;
        this.store = store;
        this.partitions = partitions;
        this.props = props;
    }

    public <R extends RawRecord> SourceRunReport run(SourceDefinition<R> def, RunContext run) {
        SourceStream stream = def.stream();
        String key = def.key();
        Instant since = tracker.getWatermark(key, props.startInstant());
        log.info("[{}] syncing since {}", key, since);

        var first = new FetchRequest(stream.account(), def.params(), since, props.pageSize(), null);
        var c = new Counters();
        try {
            PaginationResult result = paginator.fetchAll(key, def.fetcher(), first, props.maxPages(), run.pacer(),
                    page -> processPage(def, run, page, c));
            c.pages = result.pages();

            if (result.failed()) {
                tracker.recordRun(key, c.upserted, RunStatus.FAILED, result.failure(), run.startedAt());
                return report(def, RunStatus.FAILED, since, c, false, result.failure());
            }

            String note = partialNote(result);
            tracker.recordRun(key, c.upserted, RunStatus.SUCCESS, note, run.startedAt(), !result.partial());

            log.info("[{}] done: pages={} fetched={} upserted={} dropped={} invalid={} scam={}",
                    key, c.pages, c.fetched, c.upserted, c.dropped, c.invalid, c.scam);
            return report(def, RunStatus.SUCCESS, since, c, result.partial(), note);
        } catch (DataAccessException | UncheckedIOException e) {
            log.error("[{}] persistence failed after {} upserted row(s): {}", key, c.upserted, e.getMessage());
            tracker.recordRun(key, c.upserted, RunStatus.FAILED, e.getMessage(), run.startedAt());
            return report(def, RunStatus.FAILED, since, c, false, e.getMessage());
        }
    }

    private <R extends RawRecord> void processPage(SourceDefinition<R> def, RunContext run, List<R> page, Counters c) {
        String key = def.key();
        c.fetched += page.size();
        List<CanonicalTx> batch = new ArrayList<>(page.size());

        for (R raw : page) {
            if (scamFilter.isEnabled() && scamFilter.isScam(raw)) {
                c.scam++;
                log.debug("[{}] scam filter dropped {}", key, raw.sourceRef());
                continue;
            }
            NormalizeOutcome outcome = normalize(def, raw, run);
            if (!outcome.isMapped()) {
                c.dropped++;
                log.warn("[{}] dropped {}: {}", key, raw.sourceRef(), outcome.dropReason());
                continue;
            }
            var violation = validator.violation(outcome.tx());
            if (violation.isPresent()) {
                c.invalid++;
                log.warn("[{}] invalid record {}: {}", key, raw.sourceRef(), violation.get());
                continue;
            }
            batch.add(outcome.tx());
        }
        if (batch.isEmpty()) return;

        UpsertReport upserted = store.upsert(def.stream().domain(), batch);
        c.upserted += upserted.upserted();
        c.invalid += upserted.skipped();

        if (partitions.isPresent()) {
            MergeReport merged = partitions.get().merge(def.stream(), batch);
            c.partitions += merged.partitions();
        }
    }

    private String partialNote(PaginationResult result) {
        List<String> notes = new ArrayList<>();
        if (result.truncated()) notes.add("page limit " + props.maxPages() + " reached");
        if (!result.skipped().isEmpty()) notes.add("skipped: " + String.join(",", result.skipped()));
        return notes.isEmpty() ? null : String.join("; ", notes);
    }

    private static <R extends RawRecord> NormalizeOutcome normalize(SourceDefinition<R> def, R raw, RunContext run) {
        try {
            return def.normalizer().normalize(raw, def.stream(), run);
        } catch (RuntimeException e) {
            return NormalizeOutcome.dropped("normalizer error: " + e);
        }
    }

    private static SourceRunReport report(SourceDefinition<?> def, RunStatus status, Instant since,
                                          Counters c, boolean partial, String error) {
        return new SourceRunReport(def.key(), def.stream().venue(), def.stream().entity().code(), status, since,
                c.pages, c.fetched, c.scam, c.dropped, c.invalid, c.upserted, c.partitions, partial, error);
    }

    private static final class Counters {
        int pages, fetched, scam, dropped, invalid, upserted, partitions;
    }
}
