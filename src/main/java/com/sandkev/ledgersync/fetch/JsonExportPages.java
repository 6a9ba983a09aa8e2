package com.sandkev.ledgersync.fetch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.normalize.RawRecord;
import com.sandkev.ledgersync.normalize.Timestamps;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Reads one JSON export file (an array of objects) as a single page, dropping rows older than {@code since}. */
final class JsonExportPages {

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

    private JsonExportPages() {}

    static <R extends RawRecord> FetchResult<R> page(
            ObjectMapper om,
            Path file,
            FetchRequest req,
            Function<Map<String, Object>, R> mapper,
            Function<R, Object> timestamp,
            Function<R, String> currency) {
        List<Map<String, Object>> rows;
        try {
            rows = om.readValue(file.toFile(), ROWS);
        } catch (IOException e) {
            return FetchResult.permanentFailure("cannot read " + file + ": " + e.getMessage(), e);
        }
        String wantCurrency = req.param(CurrencyProber.CURRENCY_PARAM);
        List<R> out = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            R r = mapper.apply(row);
            if (wantCurrency != null && currency != null) {
                String c = currency.apply(r);
                if (c != null && !c.equalsIgnoreCase(wantCurrency)) continue;
            }
            if (req.since() != null && isBefore(timestamp.apply(r), req.since())) continue;
            out.add(r);
        }
        return FetchResult.success(out, null);
    }

    private static boolean isBefore(Object ts, Instant since) {
        if (ts == null) return false;
        try {
            return Timestamps.toUtc(ts).isBefore(since);
        } catch (IllegalArgumentException e) {
            // let the normalizer report it
            return false;
        }
    }
}
