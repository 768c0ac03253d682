package com.jobrelay.ratelimit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;

import java.time.OffsetDateTime;

@Entity
@Table(name = "jobrelay_rate_buckets")
public class RateBucket {

    @Id
    @Column(name = "bucket_key")
    private String key;

    @Column(name = "tokens", nullable = false)
    private double tokens;

    @Column(name = "capacity", nullable = false)
    private double capacity;

    @Column(name = "refill_per_second", nullable = false)
    private double refillPerSecond;

    @Column(name = "last_refill_at", nullable = false)
    private OffsetDateTime lastRefillAt;

    @Column(name = "version", nullable = false)
    private long version;

    public RateBucket() {
    }

    public RateBucket(String key, TokenBucket state) {
        this.key = key;
        this.tokens = state.tokens();
        this.capacity = state.capacity();
        this.refillPerSecond = state.refillPerSecond();
        this.lastRefillAt = state.lastRefillAt();
        this.version = 0L;
    }

    @Transient
    public TokenBucket toTokenBucket() {
        return new TokenBucket(tokens, capacity, refillPerSecond, lastRefillAt);
    }

    public String getKey() {
        return key;
    }

    public double getTokens() {
        return tokens;
    }

    public double getCapacity() {
        return capacity;
    }

    public double getRefillPerSecond() {
        return refillPerSecond;
    }

    public OffsetDateTime getLastRefillAt() {
        return lastRefillAt;
    }

    public long getVersion() {
        return version;
    }
}
