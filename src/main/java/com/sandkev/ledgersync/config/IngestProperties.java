package com.sandkev.ledgersync.config;

import com.sandkev.ledgersync.normalize.Timestamps;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What to ingest and how hard to push the upstream APIs.
 *
 * @param startTs          global start of history (ISO-8601 or epoch seconds/millis)
 * @param addresses        owned on-chain addresses
 * @param chains           chain ids fetched per address
 * @param exchanges        exchange accounts
 * @param exchangeExportDir directory of CCXT-shaped JSON exports, null when not used
 * @param tokenLogExportDir directory of exported ERC-20 transfer logs per chain and address, null when not used
 */
@ConfigurationProperties("ledger.ingest")
public record IngestProperties(
        @DefaultValue("2017-01-01T00:00:00Z") String startTs,
        @DefaultValue("100") int pageSize,
        @DefaultValue("200") int maxPages,
        @DefaultValue("5") int retryMaxAttempts,
        @DefaultValue("1000") long retryBaseDelayMs,
        @DefaultValue("15000") long retryMaxDelayMs,
        @DefaultValue("PT0.2S") Duration pacing,
        @DefaultValue("true") boolean rebuildUnifiedAfterRun,
        @DefaultValue("debank") String onchainProvider,
        List<String> addresses,
        List<String> chains,
        List<Exchange> exchanges,
        String exchangeExportDir,
        String tokenLogExportDir
) {

    public IngestProperties {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
        chains = chains == null ? List.of() : List.copyOf(chains);
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    }

    public Instant startInstant() {
        return Timestamps.toUtc(startTs);
    }

    public Set<String> ownedAddresses() {
        return addresses.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(a -> a.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param probeCurrencies when set, deposits and withdrawals are fetched once per currency
     * @param entities        subset of trades/deposits/withdrawals; all three when empty
     */
    public record Exchange(
            String name,
            @DefaultValue("main") String account,
            List<String> probeCurrencies,
            List<String> entities
    ) {
        public Exchange {
            probeCurrencies = probeCurrencies == null ? List.of() : List.copyOf(probeCurrencies);
            entities = entities == null ? List.of() : List.copyOf(entities);
        }
    }
}
