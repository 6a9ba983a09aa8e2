package com.sandkev.ledgersync.ingest;

import com.sandkev.ledgersync.domain.RunStatus;

import java.time.Instant;

/**
 * Outcome of one stream's run.
 *
 * @param since        lower bound used for the fetch
 * @param scamDropped  records removed by the scam filter
 * @param dropped      records the normalizer could not map
 * @param invalid      mapped records rejected by validation
 * @param partial      some part of the range was not served; the watermark was not advanced
 */
public record SourceRunReport(
        String key,
        String source,
        String entity,
        RunStatus status,
        Instant since,
        int pages,
        int fetched,
        int scamDropped,
        int dropped,
        int invalid,
        int upserted,
        int partitions,
        boolean partial,
        String error
) {
    public boolean succeeded() {
        return status == RunStatus.SUCCESS;
    }
}
