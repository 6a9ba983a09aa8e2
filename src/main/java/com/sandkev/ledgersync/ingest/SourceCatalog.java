package com.sandkev.ledgersync.ingest;

import com.sandkev.ledgersync.config.DebankProperties;
import com.sandkev.ledgersync.config.IngestProperties;
import com.sandkev.ledgersync.domain.EntityKind;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.fetch.BatchFetcher;
import com.sandkev.ledgersync.fetch.CurrencyProber;
import com.sandkev.ledgersync.fetch.DebankClient;
import com.sandkev.ledgersync.fetch.ExchangeFetchers;
import com.sandkev.ledgersync.fetch.Paginator;
import com.sandkev.ledgersync.fetch.RequestPacer;
import com.sandkev.ledgersync.fetch.TokenLogFetchers;
import com.sandkev.ledgersync.normalize.ExchangeTradeNormalizer;
import com.sandkev.ledgersync.normalize.ExchangeTransferNormalizer;
import com.sandkev.ledgersync.normalize.OnchainTxNormalizer;
import com.sandkev.ledgersync.normalize.RawExchangeTransfer;
import com.sandkev.ledgersync.normalize.TokenTransferLogNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns configuration into runnable stream definitions. Sources that cannot run are
 * returned as {@link SkippedSource} entries instead of failing the whole catalog.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceCatalog {

    private static final List<EntityKind> EXCHANGE_ENTITIES =
            List.of(EntityKind.TRADES, EntityKind.DEPOSITS, EntityKind.WITHDRAWALS);

    /** Provider name of exported ERC-20 transfer log streams ({@code erc20_<chain>}). */
    public static final String TOKEN_LOG_PROVIDER = "erc20";

    private final IngestProperties props;
    private final DebankProperties debankProps;
    private final DebankClient debank;
    private final ExchangeFetchers exchangeFetchers;
    private final TokenLogFetchers tokenLogFetchers;
    private final Paginator paginator;
    private final ExchangeTradeNormalizer tradeNormalizer;
    private final ExchangeTransferNormalizer transferNormalizer;
    private final OnchainTxNormalizer onchainNormalizer;
    private final TokenTransferLogNormalizer tokenLogNormalizer;

    public record Resolution(List<SourceDefinition<?>> definitions, List<SkippedSource> skipped) {

        /** Definitions whose source id or watermark key equals {@code source} (case-insensitive). */
        public Resolution only(String source) {
            String s = source.toLowerCase(Locale.ROOT);
            return new Resolution(
                    definitions.stream()
                            .filter(d -> d.stream().venue().equals(s) || d.key().equalsIgnoreCase(source))
                            .toList(),
                    skipped.stream().filter(k -> k.source().toLowerCase(Locale.ROOT).startsWith(s)).toList());
        }

        public boolean isEmpty() {
            return definitions.isEmpty() && skipped.isEmpty();
        }
    }

    public Resolution resolve(RequestPacer pacer) {
        List<SourceDefinition<?>> defs = new ArrayList<>();
        List<SkippedSource> skipped = new ArrayList<>();
        exchanges(pacer, defs, skipped);
        onchain(defs, skipped);
        tokenLogs(defs);
        skipped.forEach(s -> log.warn("Skipping source {}: {}", s.source(), s.reason()));
        return new Resolution(List.copyOf(defs), List.copyOf(skipped));
    }

    private void exchanges(RequestPacer pacer, List<SourceDefinition<?>> defs, List<SkippedSource> skipped) {
        for (IngestProperties.Exchange ex : props.exchanges()) {
            if (ex.name() == null || ex.name().isBlank()) {
                skipped.add(new SkippedSource("exchange", "exchange entry without a name"));
                continue;
            }
            String name = ex.name().trim().toLowerCase(Locale.ROOT);
            for (EntityKind kind : entitiesOf(ex, name, skipped)) {
                var stream = SourceStream.exchange(name, kind, ex.account());
                if (kind == EntityKind.TRADES) {
                    exchangeFetchers.trades(name, ex.account()).ifPresentOrElse(
                            f -> defs.add(new SourceDefinition<>(stream, f, tradeNormalizer, Map.of())),
                            () -> skipped.add(noFetcher(stream)));
                } else {
                    exchangeFetchers.transfers(name, kind, ex.account()).ifPresentOrElse(
                            f -> defs.add(new SourceDefinition<>(stream, probing(stream, f, ex, pacer),
                                    transferNormalizer, Map.of())),
                            () -> skipped.add(noFetcher(stream)));
                }
            }
        }
    }

    private static List<EntityKind> entitiesOf(IngestProperties.Exchange ex, String name, List<SkippedSource> skipped) {
        if (ex.entities().isEmpty()) return EXCHANGE_ENTITIES;
        List<EntityKind> out = new ArrayList<>();
        for (String e : ex.entities()) {
            try {
                EntityKind kind = EntityKind.fromCode(e);
                if (kind.domain() != EntityKind.TRADES.domain()) {
                    skipped.add(new SkippedSource(name + ":" + e, "not an exchange entity"));
                } else {
                    out.add(kind);
                }
            } catch (IllegalArgumentException iae) {
                skipped.add(new SkippedSource(name + ":" + e, iae.getMessage()));
            }
        }
        return out;
    }

    private BatchFetcher<RawExchangeTransfer> probing(SourceStream stream, BatchFetcher<RawExchangeTransfer> f,
                                                      IngestProperties.Exchange ex, RequestPacer pacer) {
        if (ex.probeCurrencies().isEmpty()) return f;
        return new CurrencyProber<>(stream.watermarkKey(), f, ex.probeCurrencies(), paginator,
                props.maxPages(), pacer,
                (t, currency) -> t.currency() == null ? t.withCurrency(currency) : t);
    }

    private void onchain(List<SourceDefinition<?>> defs, List<SkippedSource> skipped) {
        if (props.chains().isEmpty() && props.addresses().isEmpty()) return;
        String provider = props.onchainProvider().trim().toLowerCase(Locale.ROOT);
        if (!"debank".equals(provider)) {
            skipped.add(new SkippedSource(provider, "unknown on-chain provider"));
            return;
        }
        Set<String> owned = props.ownedAddresses();
        if (owned.isEmpty()) {
            skipped.add(new SkippedSource(provider, "no addresses configured"));
            return;
        }
        if (props.chains().isEmpty()) {
            skipped.add(new SkippedSource(provider, "no chains configured"));
            return;
        }
        if (!debankProps.configured()) {
            skipped.add(new SkippedSource(provider, "no DeBank API key configured"));
            return;
        }
        for (String address : owned.stream().sorted().toList()) {
            for (String chain : props.chains()) {
                var stream = SourceStream.onchain(provider, chain, address, owned);
                defs.add(new SourceDefinition<>(stream, debank.historyFetcher(), onchainNormalizer,
                        Map.of(DebankClient.CHAIN_PARAM, stream.chain())));
            }
        }
    }

    /** Streams only exist where an export is present; missing pairs are not reported. */
    private void tokenLogs(List<SourceDefinition<?>> defs) {
        Set<String> owned = props.ownedAddresses();
        for (String address : owned.stream().sorted().toList()) {
            for (String chain : props.chains()) {
                var stream = SourceStream.onchain(TOKEN_LOG_PROVIDER, chain, address, owned);
                tokenLogFetchers.transferLogs(stream.chain(), stream.account()).ifPresent(
                        f -> defs.add(new SourceDefinition<>(stream, f, tokenLogNormalizer, Map.of())));
            }
        }
    }

    private static SkippedSource noFetcher(SourceStream stream) {
        return new SkippedSource(stream.watermarkKey(), "no fetcher available (credentials or export missing)");
    }
}
