package com.sandkev.ledgersync.fetch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for transient fetch failures.
 * {@code maxAttempts} counts the first call.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /** Delay before retry number {@code attempt + 1}; attempt is zero-based. */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        long capped = Math.min(exponential, maxDelayMs);
        if (jitterFactor <= 0) return capped;
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (capped * jitter));
    }

    public int maxAttempts() { return maxAttempts; }

    /** 1s base, doubling up to 15s, +/-20% jitter, 5 attempts. */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, 1_000L, 15_000L, 0.2);
    }

    public static RetryPolicy immediate(int maxAttempts) {
        return new RetryPolicy(maxAttempts, 0L, 0L, 0.0);
    }
}
