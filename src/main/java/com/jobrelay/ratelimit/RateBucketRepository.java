package com.jobrelay.ratelimit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;

@Repository
public interface RateBucketRepository extends JpaRepository<RateBucket, String> {

    /**
     * Writes a new bucket state only if nobody else changed the row since {@code expectedVersion} was read.
     */
    @Modifying
    @Query("""
            UPDATE RateBucket b
            SET b.tokens = :tokens,
                b.capacity = :capacity,
                b.refillPerSecond = :refillPerSecond,
                b.lastRefillAt = :lastRefillAt,
                b.version = b.version + 1
            WHERE b.key = :key
              AND b.version = :expectedVersion
            """)
    int compareAndSet(
            @Param("key") String key,
            @Param("expectedVersion") long expectedVersion,
            @Param("tokens") double tokens,
            @Param("capacity") double capacity,
            @Param("refillPerSecond") double refillPerSecond,
            @Param("lastRefillAt") OffsetDateTime lastRefillAt);
}
