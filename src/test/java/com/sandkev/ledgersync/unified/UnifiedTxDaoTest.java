package com.sandkev.ledgersync.unified;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.store.CanonicalTxValidator;
import com.sandkev.ledgersync.store.JdbcUpsertStore;
import com.sandkev.ledgersync.store.StagedTxStore;
import com.sandkev.ledgersync.testsupport.Txs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@JdbcTest
@Import({UnifiedTxDao.class, StagedTxStore.class, JdbcUpsertStore.class, CanonicalTxValidator.class})
class UnifiedTxDaoTest {

    @Autowired
    UnifiedTxDao unified;

    @Autowired
    StagedTxStore store;

    @BeforeEach
    void seed() {
        store.upsert(List.of(
                Txs.trade("binance_trades", "t1", "2024-03-01T10:00:00Z", "1"),
                Txs.trade("binance_trades", "t2", "2024-04-01T10:00:00Z", "2"),
                Txs.trade("kraken_trades", "k1", "2024-03-05T10:00:00Z", "4"),
                Txs.onchain("debank_eth", "0xa", "2024-03-15T10:00:00Z", "5"),
                Txs.onchain("debank_arb", "0xb", "2024-03-16T10:00:00Z", "6").toBuilder().chain("arb").build()));
    }

    @Test
    void unionIsTheSumOfTheStagedTables() {
        var all = unified.query(UnifiedFilter.all(), 100);

        assertThat(all).hasSize(5);
        assertThat(all).filteredOn(t -> t.domain() == Domain.ONCHAIN).hasSize(2);
        assertThat(all.get(0).externalId()).isEqualTo("t2");
    }

    @Test
    void filtersCombine() {
        assertThat(unified.query(new UnifiedFilter(Domain.EXCHANGE, null, null, 2024, 3), 100))
                .extracting(CanonicalTx::externalId).containsExactlyInAnyOrder("t1", "k1");
        assertThat(unified.query(new UnifiedFilter(null, null, "ARB", null, null), 100))
                .extracting(CanonicalTx::externalId).containsExactly("0xb");
        assertThat(unified.query(new UnifiedFilter(null, "Binance", null, null, 4), 100))
                .extracting(CanonicalTx::externalId).containsExactly("t2");
        assertThat(unified.query(new UnifiedFilter(null, "kraken_trades", null, null, null), 100))
                .extracting(CanonicalTx::externalId).containsExactly("k1");
        assertThat(unified.query(new UnifiedFilter(null, "debank", null, null, null), 100))
                .extracting(CanonicalTx::externalId).containsExactlyInAnyOrder("0xa", "0xb");
        assertThat(unified.query(new UnifiedFilter(null, "bin", null, null, null), 100)).isEmpty();
    }

    @Test
    void rebuildMaterializesAndIsRepeatable() {
        assertThat(unified.rebuild()).isEqualTo(5);
        assertThat(unified.rebuild()).isEqualTo(5);
        assertThat(unified.materializedCount()).isEqualTo(5);
    }

    @Test
    void monthlySummaryGroupsByMonthDomainAndSource() {
        var rows = unified.monthlySummary(new UnifiedFilter(Domain.EXCHANGE, null, null, 2024, 3));

        assertThat(rows).extracting(MonthlySummary::source).containsExactly("binance_trades", "kraken_trades");
        assertThat(rows.get(1).txCount()).isEqualTo(1);
        assertThat(rows.get(1).totalAmount()).isEqualByComparingTo("4");
    }

    @Test
    void qualityChecksPassWhenKeysAreUnique() {
        var checks = unified.qualityChecks();

        assertThat(checks).hasSize(2).allMatch(QualityCheck::passed);
        assertThat(checks).extracting(QualityCheck::rows).containsExactly(3L, 2L);
    }
}
