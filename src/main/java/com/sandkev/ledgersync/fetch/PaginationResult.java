package com.sandkev.ledgersync.fetch;

import java.util.List;

/**
 * Totals of one paginated fetch.
 *
 * @param truncated true when the page safety limit stopped pagination
 * @param failure   message of the failure that ended pagination, null on success
 */
public record PaginationResult(int pages, int records, boolean truncated, List<String> skipped, String failure) {

    public PaginationResult {
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public boolean failed() { return failure != null; }

    /** True when some part of the requested range was not served. */
    public boolean partial() { return truncated || !skipped.isEmpty(); }
}
