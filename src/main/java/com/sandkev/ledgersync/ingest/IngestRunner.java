package com.sandkev.ledgersync.ingest;

import com.sandkev.ledgersync.config.DebankProperties;
import com.sandkev.ledgersync.config.IngestProperties;
import com.sandkev.ledgersync.domain.RunStatus;
import com.sandkev.ledgersync.fetch.DebankClient;
import com.sandkev.ledgersync.fetch.RequestPacer;
import com.sandkev.ledgersync.normalize.RunContext;
import com.sandkev.ledgersync.normalize.TokenMetadataResolver;
import com.sandkev.ledgersync.unified.UnifiedTxDao;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs configured sources one after another. A failing source is reported and the run
 * moves on to the next one; an interrupt stops the run between sources.
 */
@Slf4j
@Service
public class IngestRunner {

    private final SourceCatalog catalog;
    private final SourceIngestJob job;
    private final UnifiedTxDao unified;
    private final IngestProperties props;
    private final TokenMetadataResolver resolver;
    private final Clock clock;

    public IngestRunner(SourceCatalog catalog,
                        SourceIngestJob job,
                        UnifiedTxDao unified,
                        IngestProperties props,
                        DebankProperties debankProps,
                        DebankClient debank,
                        Clock clock) {
        this.catalog = catalog;
        this.job = job;
        this.unified = unified;
        this.props = props;
        this.resolver = debankProps.configured() ? debank.tokenResolver() : TokenMetadataResolver.none();
        this.clock = clock;
    }

    public synchronized RunSummary runAll() {
        RunContext run = newRun();
        return execute(run, catalog.resolve(run.pacer()));
    }

    /** Runs the streams of one source id (e.g. {@code binance}, {@code debank_eth}) or one watermark key. */
    public synchronized RunSummary runSource(String source) {
        RunContext run = newRun();
        var selected = catalog.resolve(run.pacer()).only(source);
        if (selected.isEmpty()) throw new UnknownSourceException(source);
        return execute(run, selected);
    }

    private RunSummary execute(RunContext run, SourceCatalog.Resolution sources) {
        log.info("Run {} started: {} stream(s), {} skipped", run.runId(), sources.definitions().size(), sources.skipped().size());
        List<SourceRunReport> reports = new ArrayList<>();
        for (SourceDefinition<?> def : sources.definitions()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Run {} interrupted; {} stream(s) not started", run.runId(),
                        sources.definitions().size() - reports.size());
                break;
            }
            reports.add(safeRun(def, run));
        }

        Integer unifiedRows = null;
        if (props.rebuildUnifiedAfterRun() && !reports.isEmpty()) {
            try {
                unifiedRows = unified.rebuild();
            } catch (DataAccessException e) {
                log.error("Run {}: unified rebuild failed: {}", run.runId(), e.getMessage());
            }
        }

        var summary = new RunSummary(run.runId(), run.startedAt(), clock.instant(), reports, sources.skipped(), unifiedRows);
        log.info("Run {} finished: {} stream(s), {} failed, {} upserted, {} token(s) cached",
                run.runId(), reports.size(), summary.failedCount(), summary.upserted(), run.cachedTokens());
        return summary;
    }

    private SourceRunReport safeRun(SourceDefinition<?> def, RunContext run) {
        try {
            return job.run(def, run);
        } catch (RuntimeException e) {
            log.error("[{}] failed: {}", def.key(), e.toString(), e);
            return new SourceRunReport(def.key(), def.stream().venue(), def.stream().entity().code(),
                    RunStatus.FAILED, null, 0, 0, 0, 0, 0, 0, 0, false, e.toString());
        }
    }

    private RunContext newRun() {
        return new RunContext(resolver, new RequestPacer(props.pacing()), clock);
    }
}
