package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.normalize.RawRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives a {@link BatchFetcher} until the source is exhausted or the page limit is hit.
 * Each page is handed to the consumer before the next one is requested, so an interrupted
 * run loses at most the page in flight. Exceptions thrown by the consumer propagate.
 */
@Slf4j
public class Paginator {

    private final RetryPolicy retry;
    private final Sleeper sleeper;

    public Paginator(RetryPolicy retry, Sleeper sleeper) {
        this.retry = retry;
        this.sleeper = sleeper;
    }

    public <R extends RawRecord> PaginationResult fetchAll(String label,
                                                           BatchFetcher<R> fetcher,
                                                           FetchRequest first,
                                                           int maxPages,
                                                           RequestPacer pacer,
                                                           Consumer<List<R>> onPage) {
        FetchRequest req = first;
        int pages = 0;
        int records = 0;
        List<String> skipped = new ArrayList<>();

        while (true) {
            if (pages >= maxPages) {
                log.warn("[{}] page limit {} reached; stopping with more data possibly available", label, maxPages);
                return new PaginationResult(pages, records, true, skipped, null);
            }
            if (Thread.currentThread().isInterrupted()) {
                return new PaginationResult(pages, records, false, skipped, "interrupted");
            }

            FetchResult<R> result = fetchWithRetry(label, fetcher, req, pacer);
            if (!(result instanceof FetchResult.Success<R> page)) {
                log.warn("[{}] fetch failed after {} page(s): {}", label, pages, result.failureMessage());
                return new PaginationResult(pages, records, false, skipped, result.failureMessage());
            }

            pages++;
            skipped.addAll(page.skipped());
            if (!page.records().isEmpty()) {
                onPage.accept(page.records());
                records += page.records().size();
            }
            log.debug("[{}] page {} -> {} record(s), next={}", label, pages, page.records().size(), page.nextCursor());

            if (page.records().isEmpty() || page.nextCursor() == null) {
                return new PaginationResult(pages, records, false, skipped, null);
            }
            if (page.nextCursor().equals(req.cursor())) {
                log.warn("[{}] cursor did not advance ({}); stopping", label, page.nextCursor());
                return new PaginationResult(pages, records, false, skipped, null);
            }
            req = req.withCursor(page.nextCursor());
        }
    }

    /** One logical call: transient failures are retried per the policy, everything else is returned. */
    public <R extends RawRecord> FetchResult<R> fetchWithRetry(String label,
                                                               BatchFetcher<R> fetcher,
                                                               FetchRequest req,
                                                               RequestPacer pacer) {
        for (int attempt = 0; ; attempt++) {
            pacer.beforeCall(label);
            FetchResult<R> result;
            try {
                result = fetcher.fetchBatch(req);
            } catch (RuntimeException e) {
                return FetchResult.permanentFailure("unexpected fetch error: " + e, e);
            }
            if (!(result instanceof FetchResult.TransientFailure<R> t)) {
                return result;
            }
            if (attempt + 1 >= retry.maxAttempts()) {
                return FetchResult.permanentFailure(
                        "gave up after " + retry.maxAttempts() + " attempt(s): " + t.message(), t.cause());
            }
            long sleepMs = retry.delayMs(attempt);
            log.warn("[{}] transient failure (attempt {}/{}): {}; retrying in {} ms",
                    label, attempt + 1, retry.maxAttempts(), t.message(), sleepMs);
            sleeper.sleep(sleepMs);
        }
    }
}
