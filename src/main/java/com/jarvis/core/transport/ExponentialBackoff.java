package com.jarvis.core.transport;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect delay: {@code base * 2^(attempt-1)} capped at {@code max}, with jitter in [0.5, 1.5).
 */
public final class ExponentialBackoff {

    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoff(Duration base, Duration max) {
        this(base.toMillis(), max.toMillis());
    }

    public ExponentialBackoff(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempts >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempts - 1);
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
    }
}
