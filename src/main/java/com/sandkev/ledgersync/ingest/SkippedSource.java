package com.sandkev.ledgersync.ingest;

/** A configured source that could not be run (no addresses, no credentials, ...). */
public record SkippedSource(String source, String reason) {}
