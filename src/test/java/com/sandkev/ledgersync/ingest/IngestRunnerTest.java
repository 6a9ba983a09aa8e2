package com.sandkev.ledgersync.ingest;

import com.sandkev.ledgersync.config.DebankProperties;
import com.sandkev.ledgersync.config.IngestProperties;
import com.sandkev.ledgersync.domain.EntityKind;
import com.sandkev.ledgersync.domain.RunStatus;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.fetch.DebankClient;
import com.sandkev.ledgersync.normalize.ExchangeTradeNormalizer;
import com.sandkev.ledgersync.testsupport.ListFetcher;
import com.sandkev.ledgersync.unified.UnifiedTxDao;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestRunnerTest {

    private final SourceCatalog catalog = mock(SourceCatalog.class);
    private final SourceIngestJob job = mock(SourceIngestJob.class);
    private final UnifiedTxDao unified = mock(UnifiedTxDao.class);
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-20T12:00:00Z"), ZoneOffset.UTC);
    private final ExchangeTradeNormalizer normalizer = mock(ExchangeTradeNormalizer.class);

    private SourceDefinition<?> binance;
    private SourceDefinition<?> kraken;

    @BeforeEach
    void setUp() {
        binance = new SourceDefinition<>(SourceStream.exchange("binance", EntityKind.TRADES, "main"),
                ListFetcher.pages(), normalizer, Map.of());
        kraken = new SourceDefinition<>(SourceStream.exchange("kraken", EntityKind.TRADES, "main"),
                ListFetcher.pages(), normalizer, Map.of());
        when(catalog.resolve(any())).thenReturn(new SourceCatalog.Resolution(List.of(binance, kraken),
                List.of(new SkippedSource("debank", "no addresses configured"))));
    }

    private IngestRunner runner(boolean rebuild) {
        var props = new IngestProperties("2024-01-01T00:00:00Z", 100, 10, 1, 0, 0, Duration.ZERO, rebuild,
                "debank", List.of(), List.of(), List.of(), null, null);
        var debankProps = new DebankProperties("http://localhost", "", "AccessKey", 1000, "test");
        return new IngestRunner(catalog, job, unified, props, debankProps, mock(DebankClient.class), clock);
    }

    private static SourceRunReport ok(SourceDefinition<?> def, int upserted) {
        return new SourceRunReport(def.key(), def.stream().venue(), "trades", RunStatus.SUCCESS, null,
                1, upserted, 0, 0, 0, upserted, 1, false, null);
    }

    @Test
    void oneFailingSourceDoesNotStopTheOthers() {
        when(job.run(eq(binance), any())).thenThrow(new IllegalStateException("unexpected"));
        when(job.run(eq(kraken), any())).thenReturn(ok(kraken, 4));
        when(unified.rebuild()).thenReturn(4);

        var summary = runner(true).runAll();

        assertThat(summary.sources()).extracting(SourceRunReport::status)
                .containsExactly(RunStatus.FAILED, RunStatus.SUCCESS);
        assertThat(summary.sources().get(0).error()).contains("unexpected");
        assertThat(summary.failedCount()).isEqualTo(1);
        assertThat(summary.upserted()).isEqualTo(4);
        assertThat(summary.skipped()).extracting(SkippedSource::source).containsExactly("debank");
        assertThat(summary.unifiedRows()).isEqualTo(4);
        assertThat(summary.finishedAt()).isEqualTo(clock.instant());
    }

    @Test
    void rebuildFailureStillReturnsTheSummary() {
        when(job.run(any(), any())).thenAnswer(inv -> ok(inv.getArgument(0), 1));
        when(unified.rebuild()).thenThrow(new DataAccessResourceFailureException("locked"));

        var summary = runner(true).runAll();

        assertThat(summary.sources()).hasSize(2).allMatch(SourceRunReport::succeeded);
        assertThat(summary.unifiedRows()).isNull();
    }

    @Test
    void runSourceSelectsBySourceId() {
        when(job.run(any(), any())).thenAnswer(inv -> ok(inv.getArgument(0), 2));

        var summary = runner(false).runSource("Kraken");

        assertThat(summary.sources()).extracting(SourceRunReport::source).containsExactly("kraken");
        verify(job, never()).run(eq(binance), any());
        verify(unified, never()).rebuild();
    }

    @Test
    void unknownSourceIsRejected() {
        assertThatThrownBy(() -> runner(false).runSource("bitstamp"))
                .isInstanceOf(UnknownSourceException.class)
                .hasMessageContaining("bitstamp");
    }
}
