package com.sandkev.ledgersync.ingest;

import java.time.Instant;
import java.util.List;

public record RunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        List<SourceRunReport> sources,
        List<SkippedSource> skipped,
        Integer unifiedRows              // null when the unified table was not rebuilt
) {

    public long failedCount() {
        return sources.stream().filter(r -> !r.succeeded()).count();
    }

    public int upserted() {
        return sources.stream().mapToInt(SourceRunReport::upserted).sum();
    }
}
