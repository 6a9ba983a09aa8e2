package com.sandkev.ledgersync.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.SourceStream;
import com.sandkev.ledgersync.domain.TxAction;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

import static com.sandkev.ledgersync.normalize.RawPayloads.abs;
import static com.sandkev.ledgersync.normalize.RawPayloads.blank;
import static com.sandkev.ledgersync.normalize.RawPayloads.trimToNull;

/** Exchange fills: side is taken verbatim, {@code BASE/QUOTE} is split on the first separator. */
@Component
public class ExchangeTradeNormalizer implements SourceNormalizer<RawExchangeTrade> {

    static final String SEPARATOR = "/";

    private final ObjectMapper om;

    public ExchangeTradeNormalizer(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public NormalizeOutcome normalize(RawExchangeTrade t, SourceStream stream, RunContext run) {
        if (blank(t.id())) return NormalizeOutcome.dropped("missing trade id");
        if (t.amount() == null) return NormalizeOutcome.dropped("missing amount");

        Instant ts;
        try {
            ts = Timestamps.toUtc(t.timestamp());
        } catch (IllegalArgumentException e) {
            return NormalizeOutcome.dropped(e.getMessage());
        }

        String symbol = t.symbol() == null ? "" : t.symbol().trim().toUpperCase(Locale.ROOT);
        int sep = symbol.indexOf(SEPARATOR);
        if (sep <= 0 || sep == symbol.length() - 1) {
            return NormalizeOutcome.dropped("symbol without base/quote separator: " + t.symbol());
        }
        String base = symbol.substring(0, sep);
        String quote = symbol.substring(sep + 1);
        int settle = quote.indexOf(':');          // derivatives carry a settlement suffix, e.g. BTC/USDT:USDT
        if (settle > 0) quote = quote.substring(0, settle);

        TxAction action = switch (t.side() == null ? "" : t.side().trim().toLowerCase(Locale.ROOT)) {
            case "buy" -> TxAction.TRADE_BUY;
            case "sell" -> TxAction.TRADE_SELL;
            default -> null;
        };
        if (action == null) return NormalizeOutcome.dropped("unsupported side: " + t.side());

        return NormalizeOutcome.mapped(CanonicalTx.builder()
                .domain(Domain.EXCHANGE)
                .source(stream.sourceId())
                .occurredAt(ts)
                .externalId(t.id().trim())
                .logIndex(0)
                .baseAsset(base)
                .quoteAsset(quote)
                .action(action)
                .amount(abs(t.amount()))
                .price(abs(t.price()))
                .feeAsset(trimToNull(t.feeCurrency()))
                .feeAmount(abs(t.feeCost()))
                .rawPayload(RawPayloads.toJson(om, t))
                .build());
    }
}
