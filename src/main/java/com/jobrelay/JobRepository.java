package com.jobrelay;

import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Store contract for jobs. Every method that changes ownership or lease fields is a conditional update that
 * only succeeds while its expected prior state still holds; callers treat {@code 0} affected rows as a lost
 * race.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Number of jobs per state, fetched in a single query.
     */
    interface StateCount {
        JobState getState();

        Long getTotal();
    }

    @Query("""
            SELECT j FROM Job j
            WHERE j.state IN :states
              AND j.notBefore <= :now
            ORDER BY j.priority DESC, j.createdAt ASC, j.id ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findEligible(
            @Param("states") Collection<JobState> states,
            @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Query("""
            SELECT j FROM Job j
            WHERE j.type IN :types
              AND j.state IN :states
              AND j.notBefore <= :now
            ORDER BY j.priority DESC, j.createdAt ASC, j.id ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findEligibleOfTypes(
            @Param("types") Collection<String> types,
            @Param("states") Collection<JobState> states,
            @Param("now") OffsetDateTime now,
            Pageable pageable);

    @Query("""
            SELECT j FROM Job j
            WHERE j.state = com.jobrelay.JobState.LEASED
              AND j.leaseExpiresAt < :now
            ORDER BY j.leaseExpiresAt ASC
            """)
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findExpiredLeases(@Param("now") OffsetDateTime now, Pageable pageable);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    Slice<Job> findByState(JobState state, Pageable pageable);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    Slice<Job> findByType(String type, Pageable pageable);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    Slice<Job> findByTypeAndState(String type, JobState state, Pageable pageable);

    @Query("SELECT j FROM Job j")
    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    Slice<Job> findAllJobs(Pageable pageable);

    @Query("SELECT j.state AS state, COUNT(j) AS total FROM Job j GROUP BY j.state")
    List<StateCount> countByStates();

    boolean existsByCronDefinitionIdAndScheduledFireAt(String cronDefinitionId, OffsetDateTime scheduledFireAt);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.state = com.jobrelay.JobState.LEASED,
                j.leaseOwner = :workerId,
                j.leaseExpiresAt = :expiresAt,
                j.fencingToken = :nextToken,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state IN (com.jobrelay.JobState.PENDING, com.jobrelay.JobState.RETRYING)
              AND j.notBefore <= :now
              AND j.cancelRequested = false
              AND j.fencingToken = :expectedToken
            """)
    int claim(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("expiresAt") OffsetDateTime expiresAt,
            @Param("expectedToken") long expectedToken,
            @Param("nextToken") long nextToken,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.leaseExpiresAt = :expiresAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state = com.jobrelay.JobState.LEASED
              AND j.leaseOwner = :workerId
              AND j.fencingToken = :fencingToken
              AND j.cancelRequested = false
              AND j.leaseExpiresAt >= :now
            """)
    int renewLease(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("fencingToken") long fencingToken,
            @Param("expiresAt") OffsetDateTime expiresAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.state = com.jobrelay.JobState.COMPLETED,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.lastError = NULL,
                j.finishedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state = com.jobrelay.JobState.LEASED
              AND j.leaseOwner = :workerId
              AND j.fencingToken = :fencingToken
              AND j.cancelRequested = false
            """)
    int markCompleted(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("fencingToken") long fencingToken,
            @Param("now") OffsetDateTime now);

    /**
     * Moves a job out of {@code LEASED} on behalf of the lease holder (failure report or cancellation
     * checkpoint).
     */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.state = :nextState,
                j.attemptCount = :nextAttemptCount,
                j.notBefore = :notBefore,
                j.lastError = :lastError,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.finishedAt = :finishedAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state = com.jobrelay.JobState.LEASED
              AND j.leaseOwner = :workerId
              AND j.fencingToken = :fencingToken
              AND j.attemptCount = :expectedAttemptCount
              AND j.cancelRequested = :expectedCancelRequested
            """)
    int releaseLease(
            @Param("id") UUID id,
            @Param("workerId") String workerId,
            @Param("fencingToken") long fencingToken,
            @Param("expectedAttemptCount") int expectedAttemptCount,
            @Param("expectedCancelRequested") boolean expectedCancelRequested,
            @Param("nextState") JobState nextState,
            @Param("nextAttemptCount") int nextAttemptCount,
            @Param("notBefore") OffsetDateTime notBefore,
            @Param("lastError") String lastError,
            @Param("finishedAt") OffsetDateTime finishedAt,
            @Param("now") OffsetDateTime now);

    /**
     * Moves a job out of {@code LEASED} because its lease ran out. The expiry is re-checked at write time so a
     * heartbeat that lands first wins.
     */
    @Modifying
    @Query("""
            UPDATE Job j
            SET j.state = :nextState,
                j.attemptCount = :nextAttemptCount,
                j.notBefore = :notBefore,
                j.lastError = :lastError,
                j.leaseOwner = NULL,
                j.leaseExpiresAt = NULL,
                j.finishedAt = :finishedAt,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state = com.jobrelay.JobState.LEASED
              AND j.fencingToken = :fencingToken
              AND j.leaseExpiresAt < :now
              AND j.attemptCount = :expectedAttemptCount
              AND j.cancelRequested = :expectedCancelRequested
            """)
    int expireLease(
            @Param("id") UUID id,
            @Param("fencingToken") long fencingToken,
            @Param("expectedAttemptCount") int expectedAttemptCount,
            @Param("expectedCancelRequested") boolean expectedCancelRequested,
            @Param("nextState") JobState nextState,
            @Param("nextAttemptCount") int nextAttemptCount,
            @Param("notBefore") OffsetDateTime notBefore,
            @Param("lastError") String lastError,
            @Param("finishedAt") OffsetDateTime finishedAt,
            @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.state = com.jobrelay.JobState.CANCELLED,
                j.finishedAt = :now,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state IN (com.jobrelay.JobState.PENDING, com.jobrelay.JobState.RETRYING)
            """)
    int cancelDispatchable(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE Job j
            SET j.cancelRequested = true,
                j.updatedAt = :now
            WHERE j.id = :id
              AND j.state = com.jobrelay.JobState.LEASED
            """)
    int requestCancel(@Param("id") UUID id, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("DELETE FROM Job j WHERE j.state IN :states AND j.finishedAt < :threshold")
    int deleteFinishedBefore(
            @Param("states") Collection<JobState> states,
            @Param("threshold") OffsetDateTime threshold);
}
