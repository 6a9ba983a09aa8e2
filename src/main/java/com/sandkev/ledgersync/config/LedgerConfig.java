package com.sandkev.ledgersync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.fetch.ExchangeFetchers;
import com.sandkev.ledgersync.fetch.JsonExportExchangeFetchers;
import com.sandkev.ledgersync.fetch.JsonExportTokenLogFetchers;
import com.sandkev.ledgersync.fetch.Paginator;
import com.sandkev.ledgersync.fetch.RetryPolicy;
import com.sandkev.ledgersync.fetch.Sleeper;
import com.sandkev.ledgersync.fetch.TokenLogFetchers;
import com.sandkev.ledgersync.partition.CsvPartitionStore;
import com.sandkev.ledgersync.partition.PartitionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        IngestProperties.class,
        SyncProperties.class,
        PartitionProperties.class,
        ScamFilterProperties.class
})
public class LedgerConfig {

    @Bean
    @ConditionalOnMissingBean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    RetryPolicy retryPolicy(IngestProperties p) {
        return new RetryPolicy(p.retryMaxAttempts(), p.retryBaseDelayMs(), p.retryMaxDelayMs(), 0.2);
    }

    @Bean
    Paginator paginator(RetryPolicy retryPolicy) {
        return new Paginator(retryPolicy, Sleeper.THREAD);
    }

    @Bean
    @ConditionalOnProperty(prefix = "ledger.partitions", name = "enabled", havingValue = "true", matchIfMissing = true)
    CsvPartitionStore csvPartitionStore(PartitionProperties p) {
        log.info("Partition artifacts under {}", Path.of(p.dir()).toAbsolutePath());
        return new CsvPartitionStore(Path.of(p.dir()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "ledger.partitions", name = "enabled", havingValue = "true", matchIfMissing = true)
    PartitionManager partitionManager(CsvPartitionStore store) {
        return new PartitionManager(store);
    }

    @Bean
    @ConditionalOnMissingBean
    ExchangeFetchers exchangeFetchers(IngestProperties p, ObjectProvider<ObjectMapper> om) {
        if (p.exchangeExportDir() == null || p.exchangeExportDir().isBlank()) {
            return ExchangeFetchers.none();
        }
        return new JsonExportExchangeFetchers(Path.of(p.exchangeExportDir()), om.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    TokenLogFetchers tokenLogFetchers(IngestProperties p, ObjectProvider<ObjectMapper> om) {
        if (p.tokenLogExportDir() == null || p.tokenLogExportDir().isBlank()) {
            return TokenLogFetchers.none();
        }
        return new JsonExportTokenLogFetchers(Path.of(p.tokenLogExportDir()), om.getIfAvailable(ObjectMapper::new));
    }
}
