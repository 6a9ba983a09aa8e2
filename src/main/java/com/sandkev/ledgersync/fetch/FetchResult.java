package com.sandkev.ledgersync.fetch;

import java.util.List;

/**
 * Typed outcome of one fetch call. Transient failures may be retried; permanent ones may not.
 */
public sealed interface FetchResult<R>
        permits FetchResult.Success, FetchResult.TransientFailure, FetchResult.PermanentFailure {

    /**
     * @param nextCursor continuation token, null when the source is exhausted
     * @param skipped    parts of the request that could not be served (e.g. probed currencies)
     */
    record Success<R>(List<R> records, String nextCursor, List<String> skipped) implements FetchResult<R> {
        public Success {
            records = records == null ? List.of() : List.copyOf(records);
            skipped = skipped == null ? List.of() : List.copyOf(skipped);
        }
    }

    record TransientFailure<R>(String message, Throwable cause) implements FetchResult<R> {}

    record PermanentFailure<R>(String message, Throwable cause) implements FetchResult<R> {}

    static <R> FetchResult<R> success(List<R> records, String nextCursor) {
        return new Success<>(records, nextCursor, List.of());
    }

    static <R> FetchResult<R> transientFailure(String message, Throwable cause) {
        return new TransientFailure<>(message, cause);
    }

    static <R> FetchResult<R> permanentFailure(String message, Throwable cause) {
        return new PermanentFailure<>(message, cause);
    }

    default String failureMessage() {
        if (this instanceof TransientFailure<R> t) return t.message();
        if (this instanceof PermanentFailure<R> p) return p.message();
        return null;
    }
}
