package com.jobrelay.ratelimit;

import com.jobrelay.config.JobRelayProperties;
import com.jobrelay.engine.StoreFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key token buckets gating dispatch.
 * <p>
 * Buckets live in the store so every orchestrator instance draws from the same tokens. Each check is a
 * read-refill-decrement followed by a version-guarded write; inside one instance checks on the same key are
 * additionally serialized by a per-key lock so they do not burn compare-and-set attempts against each other.
 * Keys with neither a stored bucket nor a {@code jobrelay.rate-limits.<key>} entry are unlimited. When a key is
 * configured in properties, those parameters win over the stored ones.
 */
@Component
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final RateBucketRepository rateBucketRepository;
    private final TransactionTemplate transactionTemplate;
    private final JobRelayProperties properties;
    private final ConcurrentMap<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    public RateLimiter(RateBucketRepository rateBucketRepository, TransactionTemplate transactionTemplate,
            JobRelayProperties properties) {
        this.rateBucketRepository = rateBucketRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /**
     * Takes one token from the bucket of {@code key} if one is available at {@code now}.
     *
     * @return {@code true} if the caller may proceed
     */
    public boolean allow(String key, OffsetDateTime now) {
        if (key == null) {
            return true;
        }
        return withKeyLock(key, () -> {
            for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
                Decision decision = attemptWrite(key, () -> tryAcquire(key, now));
                if (decision != Decision.RETRY) {
                    return decision == Decision.ALLOWED;
                }
            }
            log.debug("Rate bucket {} stayed contended after {} attempts; denying this check", key, MAX_WRITE_ATTEMPTS);
            return false;
        });
    }

    /**
     * Creates the bucket for {@code key} or changes its parameters. Tokens already in the bucket are kept, capped
     * at the new capacity; a new bucket starts full.
     */
    public void configure(String key, double capacity, double refillPerSecond, OffsetDateTime now) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Rate key must not be blank");
        }
        TokenBucket.full(capacity, refillPerSecond, now);
        withKeyLock(key, () -> {
            for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
                Decision decision = attemptWrite(key, () -> reconfigure(key, capacity, refillPerSecond, now));
                if (decision != Decision.RETRY) {
                    log.info("Configured rate bucket {} with capacity {} and refill {}/s", key, capacity,
                            refillPerSecond);
                    return Boolean.TRUE;
                }
            }
            throw new IllegalStateException("Could not configure rate bucket " + key + " due to concurrent updates");
        });
    }

    /**
     * Current state of the bucket for {@code key} as of {@code now}, without consuming anything.
     */
    public Optional<TokenBucket> inspect(String key, OffsetDateTime now) {
        try {
            return rateBucketRepository.findById(key).map(bucket -> bucket.toTokenBucket().refill(now));
        } catch (RuntimeException e) {
            throw StoreFailures.translate("rate bucket lookup", e);
        }
    }

    private Decision tryAcquire(String key, OffsetDateTime now) {
        JobRelayProperties.RateLimit configured = properties.getRateLimits().get(key);
        Optional<RateBucket> stored = rateBucketRepository.findById(key);

        if (stored.isEmpty()) {
            if (configured == null) {
                return Decision.ALLOWED;
            }
            TokenBucket bucket = TokenBucket.full(configured.getCapacity(), configured.getRefillPerSecond(), now);
            boolean allowed = bucket.hasToken();
            rateBucketRepository.saveAndFlush(new RateBucket(key, allowed ? bucket.consume() : bucket));
            return allowed ? Decision.ALLOWED : Decision.DENIED;
        }

        RateBucket row = stored.get();
        TokenBucket bucket = row.toTokenBucket();
        if (configured != null) {
            bucket = new TokenBucket(Math.min(bucket.tokens(), configured.getCapacity()), configured.getCapacity(),
                    configured.getRefillPerSecond(), bucket.lastRefillAt());
        }
        bucket = bucket.refill(now);
        if (!bucket.hasToken()) {
            return Decision.DENIED;
        }
        TokenBucket consumed = bucket.consume();
        int updated = rateBucketRepository.compareAndSet(key, row.getVersion(), consumed.tokens(),
                consumed.capacity(), consumed.refillPerSecond(), consumed.lastRefillAt());
        return updated > 0 ? Decision.ALLOWED : Decision.RETRY;
    }

    private Decision reconfigure(String key, double capacity, double refillPerSecond, OffsetDateTime now) {
        Optional<RateBucket> stored = rateBucketRepository.findById(key);
        if (stored.isEmpty()) {
            rateBucketRepository.saveAndFlush(new RateBucket(key, TokenBucket.full(capacity, refillPerSecond, now)));
            return Decision.ALLOWED;
        }
        RateBucket row = stored.get();
        TokenBucket current = row.toTokenBucket().refill(now);
        int updated = rateBucketRepository.compareAndSet(key, row.getVersion(), Math.min(current.tokens(), capacity),
                capacity, refillPerSecond, current.lastRefillAt());
        return updated > 0 ? Decision.ALLOWED : Decision.RETRY;
    }

    private Decision attemptWrite(String key, Supplier<Decision> write) {
        try {
            Decision decision = transactionTemplate.execute(status -> write.get());
            return decision == null ? Decision.RETRY : decision;
        } catch (DataIntegrityViolationException concurrentInsert) {
            log.debug("Rate bucket {} was created concurrently; retrying", key);
            return Decision.RETRY;
        } catch (RuntimeException e) {
            if (StoreFailures.isConflict(e)) {
                return Decision.RETRY;
            }
            throw StoreFailures.translate("rate bucket update", e);
        }
    }

    private <T> T withKeyLock(String key, Supplier<T> action) {
        ReentrantLock lock = keyLocks.computeIfAbsent(key, ignored -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private enum Decision {
        ALLOWED,
        DENIED,
        RETRY
    }
}
