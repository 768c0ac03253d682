package com.jobrelay;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface JobRunRepository extends JpaRepository<JobRun, UUID> {

    List<JobRun> findByJobIdOrderByStartedAtAsc(UUID jobId);

    @Modifying
    @Query("""
            UPDATE JobRun r
            SET r.outcome = :outcome,
                r.error = :error,
                r.finishedAt = :finishedAt
            WHERE r.jobId = :jobId
              AND r.fencingToken = :fencingToken
              AND r.outcome = com.jobrelay.JobRunOutcome.RUNNING
            """)
    int close(
            @Param("jobId") UUID jobId,
            @Param("fencingToken") long fencingToken,
            @Param("outcome") JobRunOutcome outcome,
            @Param("error") String error,
            @Param("finishedAt") OffsetDateTime finishedAt);
}
