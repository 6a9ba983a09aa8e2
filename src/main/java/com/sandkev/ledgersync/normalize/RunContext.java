package com.sandkev.ledgersync.normalize;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sandkev.ledgersync.fetch.RequestPacer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * State scoped to one ingestion run: the token-metadata cache and the request pacer.
 * Created at the start of a run and discarded at its end; nothing here is persisted.
 */
@Slf4j
public final class RunContext {

    private final String runId;
    private final Instant startedAt;
    private final TokenMetadataResolver resolver;
    private final RequestPacer pacer;
    private final Cache<String, TokenMeta> tokenCache = Caffeine.newBuilder()
            .maximumSize(50_000)
            .build();

    public RunContext(TokenMetadataResolver resolver, RequestPacer pacer, Clock clock) {
        this.runId = UUID.randomUUID().toString();
        this.startedAt = clock.instant();
        this.resolver = resolver;
        this.pacer = pacer;
    }

    public static RunContext create(TokenMetadataResolver resolver) {
        return new RunContext(resolver, RequestPacer.unpaced(), Clock.systemUTC());
    }

    public String runId() { return runId; }

    public Instant startedAt() { return startedAt; }

    public RequestPacer pacer() { return pacer; }

    /**
     * Metadata for {@code (chain, assetId)}: well-known table first, then the run cache,
     * then the resolver. Lookup failures degrade to {@link TokenMeta#placeholderFor}.
     */
    public TokenMeta token(String chain, String assetId) {
        Optional<TokenMeta> known = WellKnownTokens.lookup(chain, assetId);
        if (known.isPresent()) return known.get();
        if (assetId == null || assetId.isBlank()) return TokenMeta.placeholderFor(assetId);

        String key = (chain == null ? "" : chain.toLowerCase(Locale.ROOT)) + ":" + assetId.trim().toLowerCase(Locale.ROOT);
        return tokenCache.get(key, k -> lookup(chain, assetId));
    }

    public long cachedTokens() {
        return tokenCache.estimatedSize();
    }

    private TokenMeta lookup(String chain, String assetId) {
        try {
            Optional<TokenMeta> resolved = resolver.resolve(chain, assetId);
            if (resolved.isPresent() && resolved.get().symbol() != null && !resolved.get().symbol().isBlank()) {
                return resolved.get();
            }
            log.debug("No metadata for {} on {}; using placeholder", assetId, chain);
        } catch (RuntimeException e) {
            log.warn("Token metadata lookup failed for {} on {}: {}", assetId, chain, e.toString());
        }
        return TokenMeta.placeholderFor(assetId);
    }
}
