package com.jobrelay.ratelimit;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Immutable token bucket state. Refill is lazy: the bucket is topped up from the elapsed time whenever it is
 * inspected.
 */
public record TokenBucket(double tokens, double capacity, double refillPerSecond, OffsetDateTime lastRefillAt) {

    public TokenBucket {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        if (refillPerSecond < 0) {
            throw new IllegalArgumentException("refillPerSecond must be >= 0");
        }
    }

    public static TokenBucket full(double capacity, double refillPerSecond, OffsetDateTime now) {
        return new TokenBucket(capacity, capacity, refillPerSecond, now);
    }

    /**
     * Returns the bucket as it stands at {@code now}. A clock that moved backwards refills nothing.
     */
    public TokenBucket refill(OffsetDateTime now) {
        if (!now.isAfter(lastRefillAt)) {
            return this;
        }
        double elapsedSeconds = Duration.between(lastRefillAt, now).toNanos() / 1_000_000_000.0;
        double refilled = Math.min(capacity, tokens + elapsedSeconds * refillPerSecond);
        return new TokenBucket(refilled, capacity, refillPerSecond, now);
    }

    public boolean hasToken() {
        return tokens >= 1.0;
    }

    public TokenBucket consume() {
        if (!hasToken()) {
            throw new IllegalStateException("No token available");
        }
        return new TokenBucket(tokens - 1.0, capacity, refillPerSecond, lastRefillAt);
    }
}
