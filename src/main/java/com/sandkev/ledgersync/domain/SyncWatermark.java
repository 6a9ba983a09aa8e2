package com.sandkev.ledgersync.domain;

import java.time.Instant;

/**
 * Latest sync outcome for one source stream. {@code lastSyncAt} only moves on a successful
 * run, so a failed run leaves the next fetch window where it was.
 */
public record SyncWatermark(
        String source,
        Instant lastSyncAt,          // nullable until the first successful run
        int lastRunRecordCount,
        RunStatus lastRunStatus,
        String lastError,            // nullable
        Instant updatedAt
) {}
