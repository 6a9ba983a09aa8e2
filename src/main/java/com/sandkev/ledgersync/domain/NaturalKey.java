package com.sandkev.ledgersync.domain;

import java.util.List;

/** Uniqueness key of a stored record: (source, external_id, log_index). */
public record NaturalKey(String source, String externalId, int logIndex) {

    public static final List<String> COLUMNS = List.of("source", "external_id", "log_index");

    @Override
    public String toString() {
        return source + ":" + externalId + "#" + logIndex;
    }
}
