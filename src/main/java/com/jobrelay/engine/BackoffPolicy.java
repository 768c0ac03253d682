package com.jobrelay.engine;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Capped exponential backoff with full jitter.
 * <p>
 * For attempt {@code n} (1-based) the ceiling is {@code min(maxDelay, baseDelay * 2^(n-1))} and the delay is drawn
 * uniformly from {@code [0, ceiling]}.
 */
public class BackoffPolicy {

    private final RandomGenerator random;

    public BackoffPolicy() {
        this(null);
    }

    /**
     * @param random jitter source; {@code null} uses the calling thread's {@link ThreadLocalRandom}
     */
    public BackoffPolicy(RandomGenerator random) {
        this.random = random;
    }

    public Duration ceiling(int attempt, Duration baseDelay, Duration maxDelay) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        long baseMs = Math.max(0L, baseDelay.toMillis());
        long maxMs = Math.max(0L, maxDelay.toMillis());
        int exponent = attempt - 1;
        if (baseMs == 0L) {
            return Duration.ZERO;
        }
        if (exponent >= Long.SIZE - 2 || baseMs > (maxMs >> exponent)) {
            return Duration.ofMillis(maxMs);
        }
        return Duration.ofMillis(Math.min(maxMs, baseMs << exponent));
    }

    public Duration delay(int attempt, Duration baseDelay, Duration maxDelay) {
        long ceilingMs = ceiling(attempt, baseDelay, maxDelay).toMillis();
        if (ceilingMs == 0L) {
            return Duration.ZERO;
        }
        RandomGenerator source = random != null ? random : ThreadLocalRandom.current();
        return Duration.ofMillis(source.nextLong(ceilingMs + 1));
    }

    public OffsetDateTime nextEligibleAt(int attempt, Duration baseDelay, Duration maxDelay, OffsetDateTime now) {
        return now.plus(delay(attempt, baseDelay, maxDelay));
    }
}
