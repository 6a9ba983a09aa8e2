package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.normalize.RawRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * For providers that cannot list transfers without an asset: pages through each configured
 * currency until it is exhausted and merges the rows into one page. A currency that fails,
 * or that still has data when its page limit is hit, is reported in
 * {@link FetchResult.Success#skipped()} so the run counts as partial. The request only fails
 * when every currency failed before returning anything.
 */
@Slf4j
public class CurrencyProber<R extends RawRecord> implements BatchFetcher<R> {

    public static final String CURRENCY_PARAM = "currency";

    private final String label;
    private final BatchFetcher<R> perCurrency;
    private final List<String> currencies;
    private final Paginator paginator;
    private final int maxPagesPerCurrency;
    private final RequestPacer pacer;
    private final BiFunction<R, String, R> tagCurrency;

    public CurrencyProber(String label,
                          BatchFetcher<R> perCurrency,
                          List<String> currencies,
                          Paginator paginator,
                          int maxPagesPerCurrency,
                          RequestPacer pacer,
                          BiFunction<R, String, R> tagCurrency) {
        this.label = label;
        this.perCurrency = perCurrency;
        this.currencies = List.copyOf(currencies);
        this.paginator = paginator;
        this.maxPagesPerCurrency = maxPagesPerCurrency;
        this.pacer = pacer;
        this.tagCurrency = tagCurrency;
    }

    @Override
    public FetchResult<R> fetchBatch(FetchRequest request) {
        List<R> merged = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        int failedOutright = 0;
        String lastFailure = null;

        for (String currency : currencies) {
            FetchRequest first = request.withParam(CURRENCY_PARAM, currency).withCursor(null);
            PaginationResult result = paginator.fetchAll(label + ":" + currency, perCurrency, first,
                    maxPagesPerCurrency, pacer, page -> page.forEach(r -> merged.add(tagCurrency.apply(r, currency))));
            if (result.failed()) {
                lastFailure = result.failure();
                skipped.add(currency);
                if (result.pages() == 0) failedOutright++;
                log.warn("[{}] skipping rest of currency {} after {} page(s): {}",
                        label, currency, result.pages(), lastFailure);
            } else if (result.truncated()) {
                skipped.add(currency);
                log.warn("[{}] currency {} hit the page limit {}; more data may be available",
                        label, currency, maxPagesPerCurrency);
            } else {
                log.info("[{}] {} {} record(s) in {} page(s)", label, result.records(), currency, result.pages());
            }
        }

        if (!currencies.isEmpty() && failedOutright == currencies.size()) {
            return FetchResult.permanentFailure("all probed currencies failed; last error: " + lastFailure, null);
        }
        return new FetchResult.Success<>(merged, null, skipped);
    }
}
