package com.sandkev.ledgersync.normalize;

import com.sandkev.ledgersync.domain.SourceStream;

/**
 * Total mapping from one source-family record to zero or one canonical records.
 * Implementations never throw for bad input; they return {@link NormalizeOutcome#dropped}.
 */
public interface SourceNormalizer<R extends RawRecord> {

    NormalizeOutcome normalize(R raw, SourceStream stream, RunContext run);
}
