package com.sandkev.ledgersync.normalize;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.function.Supplier;

/**
 * Converts upstream timestamps to UTC instants at second granularity.
 * Numbers above {@link #MILLIS_THRESHOLD} are epoch millis, below it epoch seconds.
 * Strings may be numeric, ISO-8601 with offset, or an offset-less date-time taken as UTC.
 */
public final class Timestamps {

    public static final double MILLIS_THRESHOLD = 1e10;

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {}

    public static Instant toUtc(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("timestamp is missing");
        }
        if (value instanceof Instant i) {
            return i.truncatedTo(ChronoUnit.SECONDS);
        }
        if (value instanceof Number n) {
            return fromEpoch(new BigDecimal(n.toString()));
        }
        String s = value.toString().trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("timestamp is blank");
        }
        if (s.matches("-?\\d+(\\.\\d+)?")) {
            return fromEpoch(new BigDecimal(s));
        }
        return parseText(s);
    }

    private static Instant fromEpoch(BigDecimal epoch) {
        if (epoch.signum() < 0) {
            throw new IllegalArgumentException("negative epoch: " + epoch);
        }
        long seconds = epoch.doubleValue() > MILLIS_THRESHOLD
                ? epoch.movePointLeft(3).longValue()
                : epoch.longValue();
        return Instant.ofEpochSecond(seconds);
    }

    private static Instant parseText(String s) {
        Instant parsed = tryParse(() -> OffsetDateTime.parse(s.replace(' ', 'T')).toInstant());
        if (parsed == null) parsed = tryParse(() -> LocalDateTime.parse(s, SPACE_SEPARATED).toInstant(ZoneOffset.UTC));
        if (parsed == null) parsed = tryParse(() -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC));
        if (parsed == null) {
            throw new IllegalArgumentException("unparseable timestamp: " + s);
        }
        return parsed.truncatedTo(ChronoUnit.SECONDS);
    }

    private static Instant tryParse(Supplier<Instant> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
