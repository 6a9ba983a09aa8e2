package com.sandkev.ledgersync.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.normalize.RawTokenTransferLog;
import com.sandkev.ledgersync.testsupport.ClasspathFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonExportTokenLogFetchersTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";

    @TempDir
    Path dir;

    private JsonExportTokenLogFetchers fetchers;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(dir.resolve("eth"));
        Files.writeString(dir.resolve("eth").resolve(OWNER + ".json"), ClasspathFixtures.text("/logs/eth_transfers.json"));
        fetchers = new JsonExportTokenLogFetchers(dir, new ObjectMapper());
    }

    @Test
    void readsLogsNewerThanSince() {
        var fetcher = fetchers.transferLogs("ETH", OWNER).orElseThrow();

        var page = (FetchResult.Success<RawTokenTransferLog>) fetcher.fetchBatch(
                new FetchRequest(OWNER, Map.of(), Instant.parse("2024-01-01T00:00:00Z"), 100, null));

        assertThat(page.records()).singleElement().satisfies(log -> {
            assertThat(log.txHash()).isEqualTo("0xlog1");
            assertThat(log.logIndex()).isEqualTo(3);
            assertThat(log.value()).isEqualTo(new BigInteger("2000000000000000000"));
        });
        assertThat(page.nextCursor()).isNull();
    }

    @Test
    void noExportMeansNoFetcher() {
        assertThat(fetchers.transferLogs("arb", OWNER)).isEmpty();
        assertThat(TokenLogFetchers.none().transferLogs("eth", OWNER)).isEmpty();
    }
}
