package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.normalize.RawRecord;

/**
 * Fetch collaborator for one source stream: returns one page of raw records per call.
 * Implementations report failures as values instead of throwing.
 */
@FunctionalInterface
public interface BatchFetcher<R extends RawRecord> {

    FetchResult<R> fetchBatch(FetchRequest request);
}
