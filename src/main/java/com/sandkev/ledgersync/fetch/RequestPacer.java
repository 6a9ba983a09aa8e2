package com.sandkev.ledgersync.fetch;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Per-key minimum spacing between upstream calls (one key per provider).
 * Owned by a single run; not shared across runs.
 */
public class RequestPacer {

    private final Duration minInterval;
    private final LongSupplier nowMillis;
    private final Sleeper sleeper;
    private final Map<String, Long> lastCallAt = new HashMap<>();

    public RequestPacer(Duration minInterval) {
        this(minInterval, System::currentTimeMillis, Sleeper.THREAD);
    }

    public RequestPacer(Duration minInterval, LongSupplier nowMillis, Sleeper sleeper) {
        this.minInterval = minInterval;
        this.nowMillis = nowMillis;
        this.sleeper = sleeper;
    }

    public synchronized void beforeCall(String key) {
        long now = nowMillis.getAsLong();
        Long last = lastCallAt.get(key);
        if (last != null) {
            long wait = minInterval.toMillis() - (now - last);
            if (wait > 0) {
                sleeper.sleep(wait);
                now = nowMillis.getAsLong();
            }
        }
        lastCallAt.put(key, now);
    }

    public static RequestPacer unpaced() {
        return new RequestPacer(Duration.ZERO);
    }
}
