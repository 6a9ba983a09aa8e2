package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.normalize.RawOnchainTx;
import com.sandkev.ledgersync.normalize.Timestamps;
import com.sandkev.ledgersync.normalize.TokenMeta;
import com.sandkev.ledgersync.normalize.TokenMetadataResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DeBank open API: paged transaction history per (address, chain) and token metadata.
 * History is newest first and {@code start_time} returns entries strictly earlier than it.
 * The next page starts one second past the oldest {@code time_at} seen, so the rest of that
 * second is fetched again; the idempotent upsert absorbs the overlap.
 */
@Slf4j
public class DebankClient {

    public static final String CHAIN_PARAM = "chain";

    private final WebClient http;

    public DebankClient(WebClient debankWebClient) {
        this.http = debankWebClient;
    }

    /** Fetcher over one chain's history; the chain comes from the stream's request params. */
    public BatchFetcher<RawOnchainTx> historyFetcher() {
        return this::historyPage;
    }

    public FetchResult<RawOnchainTx> historyPage(FetchRequest req) {
        String chain = req.param(CHAIN_PARAM);
        Map<?, ?> body;
        try {
            body = http.get()
                    .uri(uri -> {
                        var b = uri.path("/v1/user/history_list")
                                .queryParam("id", req.account())
                                .queryParam("chain_id", chain)
                                .queryParam("page_count", req.pageSize());
                        if (req.cursor() != null) b.queryParam("start_time", req.cursor());
                        return b.build();
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block();
        } catch (WebClientResponseException e) {
            return classify(e);
        } catch (WebClientRequestException e) {
            return FetchResult.transientFailure("debank unreachable: " + e.getMessage(), e);
        }

        if (body == null) return FetchResult.success(List.of(), null);

        List<RawOnchainTx> rows = new ArrayList<>();
        Object list = body.get("history_list");
        boolean reachedSince = false;
        Instant oldest = null;
        BigDecimal oldestRaw = null;
        int seen = 0;
        if (list instanceof List<?> items) {
            for (Object item : items) {
                if (!(item instanceof Map<?, ?> m)) continue;
                seen++;
                @SuppressWarnings("unchecked")
                RawOnchainTx tx = RawRecordMapper.onchainTx((Map<String, Object>) m, chain);
                Instant at = timeOf(tx);
                BigDecimal raw = RawRecordMapper.dec(tx.timeAt());
                if (at != null && (oldest == null || at.isBefore(oldest)
                        || (at.equals(oldest) && raw != null && oldestRaw != null && raw.compareTo(oldestRaw) < 0))) {
                    oldest = at;
                    oldestRaw = raw;
                }
                if (at != null && req.since() != null && at.isBefore(req.since())) {
                    reachedSince = true;
                    continue;
                }
                rows.add(tx);
            }
        }

        String next = null;
        if (!reachedSince && seen >= req.pageSize() && oldest != null) {
            next = nextStartTime(oldest, oldestRaw, req.cursor());
        }
        return FetchResult.success(rows, next);
    }

    static String nextStartTime(Instant oldest, BigDecimal oldestRaw, String current) {
        String next = Long.toString(oldest.getEpochSecond() + 1);
        // a full page inside one second would repeat the request; step to the exact oldest time instead
        if (next.equals(current) && oldestRaw != null) {
            BigDecimal seconds = oldestRaw.doubleValue() > Timestamps.MILLIS_THRESHOLD ? oldestRaw.movePointLeft(3) : oldestRaw;
            next = seconds.stripTrailingZeros().toPlainString();
        }
        return next;
    }

    /** Resolver backed by {@code /v1/token}; unknown tokens resolve to empty. */
    public TokenMetadataResolver tokenResolver() {
        return (chain, tokenId) -> {
            Map<?, ?> body;
            try {
                body = http.get()
                        .uri(uri -> uri.path("/v1/token")
                                .queryParam("chain_id", chain)
                                .queryParam("id", tokenId)
                                .build())
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(Map.class)
                        .block();
            } catch (WebClientResponseException.NotFound e) {
                return Optional.empty();
            }
            if (body == null) return Optional.empty();
            String symbol = RawRecordMapper.str(body.get("symbol"));
            if (symbol == null) symbol = RawRecordMapper.str(body.get("optimized_symbol"));
            if (symbol == null) return Optional.empty();
            BigDecimal decimals = RawRecordMapper.dec(body.get("decimals"));
            return Optional.of(TokenMeta.of(symbol, decimals == null ? 18 : decimals.intValue()));
        };
    }

    private static Instant timeOf(RawOnchainTx tx) {
        if (tx.timeAt() == null) return null;
        try {
            return Timestamps.toUtc(tx.timeAt());
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable time_at {} on {}", tx.timeAt(), tx.id());
            return null;
        }
    }

    static <R> FetchResult<R> classify(WebClientResponseException e) {
        int status = e.getStatusCode().value();
        String msg = "debank HTTP " + status + ": " + e.getStatusText();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value() || e.getStatusCode().is5xxServerError()) {
            return FetchResult.transientFailure(msg, e);
        }
        return FetchResult.permanentFailure(msg, e);
    }
}
