package com.sandkev.ledgersync.partition;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.EntityKind;
import com.sandkev.ledgersync.testsupport.Txs;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CsvPartitionStoreTest {

    @TempDir
    Path root;

    @Test
    void writesUnderDomainSourceAndEntityAndReadsBack() throws Exception {
        var store = new CsvPartitionStore(root);
        var key = new PartitionKey(Domain.ONCHAIN, "debank_eth", EntityKind.TRANSFERS, YearMonth.of(2024, 3));
        CanonicalTx tx = Txs.onchain("debank_eth", "0xa", "2024-03-15T10:53:20Z", "5").toBuilder()
                .rawPayload("{\"id\":\"0xa\",\"note\":\"comma, \\\"quoted\\\"\"}")
                .build();

        store.write(key, List.of(tx));

        Path file = root.resolve("onchain/debank_eth/transfers_2024-03.csv");
        assertThat(file).exists();
        assertThat(Files.readAllLines(file).get(0)).startsWith("domain,source,occurred_at,external_id,log_index");
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertThat(files).containsExactly(file);
        }

        var back = store.read(key).orElseThrow();
        assertThat(back).hasSize(1);
        var row = back.get(0);
        assertThat(row.naturalKey()).isEqualTo(tx.naturalKey());
        assertThat(row.occurredAt()).isEqualTo(tx.occurredAt());
        assertThat(row.amount()).isEqualByComparingTo("5");
        assertThat(row.price()).isNull();
        assertThat(row.quoteAsset()).isEmpty();
        assertThat(row.rawPayload()).isEqualTo(tx.rawPayload());
    }

    @Test
    void missingPartitionIsEmpty() {
        var store = new CsvPartitionStore(root);
        var key = new PartitionKey(Domain.EXCHANGE, "binance", EntityKind.TRADES, YearMonth.of(2020, 1));

        assertThat(store.read(key)).isEmpty();
    }

    @Test
    void rewriteReplacesTheFile() {
        var store = new CsvPartitionStore(root);
        var key = new PartitionKey(Domain.EXCHANGE, "binance", EntityKind.TRADES, YearMonth.of(2024, 3));

        store.write(key, List.of(Txs.trade("binance", "1", "2024-03-01T00:00:00Z", "1"),
                Txs.trade("binance", "2", "2024-03-02T00:00:00Z", "1")));
        store.write(key, List.of(Txs.trade("binance", "3", "2024-03-03T00:00:00Z", "1")));

        assertThat(store.read(key).orElseThrow()).extracting(CanonicalTx::externalId).containsExactly("3");
    }
}
