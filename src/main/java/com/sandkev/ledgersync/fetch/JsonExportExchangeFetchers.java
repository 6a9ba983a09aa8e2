package com.sandkev.ledgersync.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.EntityKind;
import com.sandkev.ledgersync.normalize.RawExchangeTrade;
import com.sandkev.ledgersync.normalize.RawExchangeTransfer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Serves exchange history from CCXT-shaped JSON exports laid out as
 * {@code <dir>/<exchange>/<entity>.json} (a JSON array of unified structures).
 * Rows older than the request's {@code since} are filtered out; when a
 * {@code currency} param is present only that currency is returned.
 */
@Slf4j
public class JsonExportExchangeFetchers implements ExchangeFetchers {

    private final Path dir;
    private final ObjectMapper om;

    public JsonExportExchangeFetchers(Path dir, ObjectMapper om) {
        this.dir = dir;
        this.om = om;
    }

    @Override
    public Optional<BatchFetcher<RawExchangeTrade>> trades(String exchange, String account) {
        return fileFor(exchange, EntityKind.TRADES).map(this::tradeFetcher);
    }

    @Override
    public Optional<BatchFetcher<RawExchangeTransfer>> transfers(String exchange, EntityKind kind, String account) {
        return fileFor(exchange, kind).map(this::transferFetcher);
    }

    private BatchFetcher<RawExchangeTrade> tradeFetcher(Path file) {
        return req -> JsonExportPages.page(om, file, req, RawRecordMapper::exchangeTrade, RawExchangeTrade::timestamp, null);
    }

    private BatchFetcher<RawExchangeTransfer> transferFetcher(Path file) {
        return req -> JsonExportPages.page(om, file, req, RawRecordMapper::exchangeTransfer, RawExchangeTransfer::timestamp,
                RawExchangeTransfer::currency);
    }

    private Optional<Path> fileFor(String exchange, EntityKind kind) {
        Path f = dir.resolve(exchange.toLowerCase(Locale.ROOT)).resolve(kind.code() + ".json");
        if (!Files.isRegularFile(f)) {
            log.debug("No export at {}", f);
            return Optional.empty();
        }
        return Optional.of(f);
    }
}
