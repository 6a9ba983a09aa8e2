package com.sandkev.ledgersync.web;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.partition.PartitionManager;
import com.sandkev.ledgersync.store.StagedTxStore;
import com.sandkev.ledgersync.unified.MonthlySummary;
import com.sandkev.ledgersync.unified.QualityCheck;
import com.sandkev.ledgersync.unified.UnifiedFilter;
import com.sandkev.ledgersync.unified.UnifiedTxDao;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/tx")
public class LedgerApi {

    private static final int MAX_LIMIT = 10_000;

    private final UnifiedTxDao unified;
    private final StagedTxStore store;
    private final Optional<PartitionManager> partitions;

    public LedgerApi(UnifiedTxDao unified, StagedTxStore store, Optional<PartitionManager> partitions) {
        this.unified = unified;
        this.store = store;
        this.partitions = partitions;
    }

    @GetMapping
    public List<CanonicalTx> list(@RequestParam(required = false) String domain,
                                  @RequestParam(required = false) String source,
                                  @RequestParam(required = false) String chain,
                                  @RequestParam(required = false) Integer year,
                                  @RequestParam(required = false) Integer month,
                                  @RequestParam(defaultValue = "500") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be 1.." + MAX_LIMIT);
        }
        return unified.query(filter(domain, source, chain, year, month), limit);
    }

    @GetMapping("/summary")
    public List<MonthlySummary> summary(@RequestParam(required = false) String domain,
                                        @RequestParam(required = false) String source,
                                        @RequestParam(required = false) String chain,
                                        @RequestParam(required = false) Integer year,
                                        @RequestParam(required = false) Integer month) {
        return unified.monthlySummary(filter(domain, source, chain, year, month));
    }

    @GetMapping("/quality")
    public List<QualityCheck> quality() {
        return unified.qualityChecks();
    }

    @PostMapping("/rebuild")
    public RebuildResponse rebuild() {
        return new RebuildResponse(unified.rebuild());
    }

    /** Re-derives every partition file from the staged tables. */
    @PostMapping("/partitions/rebuild")
    public RebuildResponse rebuildPartitions() {
        PartitionManager manager = partitions.orElseThrow(
                () -> new IllegalArgumentException("partitions are disabled (ledger.partitions.enabled=false)"));
        int written = 0;
        for (Domain d : Domain.values()) {
            written += manager.rebuildFromStore(store, d);
        }
        return new RebuildResponse(written);
    }

    private static UnifiedFilter filter(String domain, String source, String chain, Integer year, Integer month) {
        Domain d = (domain == null || domain.isBlank()) ? null : Domain.fromCode(domain);
        return new UnifiedFilter(d, source, chain, year, month);
    }

    public record RebuildResponse(int rows) {}
}
