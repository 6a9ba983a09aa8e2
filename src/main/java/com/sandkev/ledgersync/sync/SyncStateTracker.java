package com.sandkev.ledgersync.sync;

import com.sandkev.ledgersync.config.SyncProperties;
import com.sandkev.ledgersync.domain.RunStatus;
import com.sandkev.ledgersync.domain.SyncWatermark;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-source watermark: decides where the next fetch starts and records each run's outcome.
 * <p>
 * The watermark is advisory. When the backing store cannot be read the tracker falls back to
 * the configured start (a full-range fetch); when it cannot be written the failure is logged
 * and the run carries on. The upsert store keeps re-fetched rows idempotent either way.
 */
@Slf4j
@Service
public class SyncStateTracker {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final SyncStateDao dao;
    private final Duration overlap;
    private final Clock clock;

    public SyncStateTracker(SyncStateDao dao, SyncProperties props, Clock clock) {
        this.dao = dao;
        this.overlap = props.overlap();
        this.clock = clock;
    }

    /**
     * Lower bound for "new" data: {@code configuredStart} on the first run, otherwise the last
     * successful sync minus the overlap window, never earlier than {@code configuredStart}.
     */
    public Instant getWatermark(String source, Instant configuredStart) {
        Instant start = configuredStart == null ? Instant.EPOCH : configuredStart;
        Optional<SyncWatermark> row;
        try {
            row = dao.find(source);
        } catch (DataAccessException e) {
            log.warn("[{}] sync state unavailable ({}); falling back to full-range fetch from {}",
                    source, e.getMessage(), start);
            return start;
        }
        if (row.isEmpty() || row.get().lastSyncAt() == null) {
            return start;
        }
        Instant withOverlap = row.get().lastSyncAt().minus(overlap);
        return withOverlap.isBefore(start) ? start : withOverlap;
    }

    /** Records a run that covered everything up to {@code syncedUpTo} when it succeeded. */
    public void recordRun(String source, int count, RunStatus status, String error, Instant syncedUpTo) {
        recordRun(source, count, status, error, syncedUpTo, status == RunStatus.SUCCESS);
    }

    /**
     * Persists the outcome of one run. {@code lastSyncAt} moves to {@code syncedUpTo} only when
     * {@code advance} is set; otherwise the previous value is kept so the next run re-covers the gap.
     */
    public void recordRun(String source, int count, RunStatus status, String error,
                          Instant syncedUpTo, boolean advance) {
        try {
            Instant previous = dao.find(source).map(SyncWatermark::lastSyncAt).orElse(null);
            Instant lastSyncAt = advance && status == RunStatus.SUCCESS ? syncedUpTo : previous;
            dao.save(new SyncWatermark(source, lastSyncAt, count, status, truncate(error), clock.instant()));
            log.info("[{}] run recorded: status={} records={} lastSyncAt={}", source, status, count, lastSyncAt);
        } catch (DataAccessException e) {
            log.error("[{}] could not record run outcome {} ({} records): {}", source, status, count, e.getMessage());
        }
    }

    public List<SyncWatermark> all() {
        return dao.findAll();
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
