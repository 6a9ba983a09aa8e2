package com.sandkev.ledgersync.ingest;

public class UnknownSourceException extends RuntimeException {

    public UnknownSourceException(String source) {
        super("No configured source matches '" + source + "'");
    }
}
