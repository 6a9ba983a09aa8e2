package com.sandkev.ledgersync.web;

import com.sandkev.ledgersync.domain.SyncWatermark;
import com.sandkev.ledgersync.ingest.IngestRunner;
import com.sandkev.ledgersync.ingest.RunSummary;
import com.sandkev.ledgersync.sync.SyncStateTracker;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/sync")
public class SyncApi {

    private final IngestRunner runner;
    private final SyncStateTracker tracker;

    public SyncApi(IngestRunner runner, SyncStateTracker tracker) {
        this.runner = runner;
        this.tracker = tracker;
    }

    @PostMapping
    public RunSummary runAll() {
        return runner.runAll();
    }

    @PostMapping("/{sourceId}")
    public RunSummary runOne(@PathVariable String sourceId) {
        return runner.runSource(sourceId);
    }

    @GetMapping("/state")
    public List<SyncWatermark> state() {
        return tracker.all();
    }
}
