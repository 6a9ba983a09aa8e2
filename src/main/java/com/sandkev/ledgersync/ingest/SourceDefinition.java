package com.sandkev.ledgersync.ingest;

import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.fetch.BatchFetcher;
import com.sandkev.ledgersync.normalize.RawRecord;
import com.sandkev.ledgersync.normalize.SourceNormalizer;

import java.util.Map;

/** A runnable stream: where to fetch it from and how to normalize what comes back. */
public record SourceDefinition<R extends RawRecord>(
        SourceStream stream,
        BatchFetcher<R> fetcher,
        SourceNormalizer<R> normalizer,
        Map<String, String> params
) {
    public SourceDefinition {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public String key() {
        return stream.watermarkKey();
    }
}
