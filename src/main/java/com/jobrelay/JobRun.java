package com.jobrelay;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One execution attempt of a job: opened when a lease is granted, closed in the same transaction as the
 * transition that ends the lease.
 */
@Entity
@Table(name = "jobrelay_job_runs")
public class JobRun {

    @Id
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "worker_id", nullable = false)
    private String workerId;

    @Column(name = "fencing_token", nullable = false)
    private long fencingToken;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "finished_at")
    private OffsetDateTime finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false)
    private JobRunOutcome outcome = JobRunOutcome.RUNNING;

    @Column(name = "error")
    private String error;

    public JobRun() {
    }

    public JobRun(UUID id, UUID jobId, String workerId, long fencingToken, OffsetDateTime startedAt) {
        this.id = id;
        this.jobId = jobId;
        this.workerId = workerId;
        this.fencingToken = fencingToken;
        this.startedAt = startedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getJobId() {
        return jobId;
    }

    public String getWorkerId() {
        return workerId;
    }

    public long getFencingToken() {
        return fencingToken;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(OffsetDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public JobRunOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(JobRunOutcome outcome) {
        this.outcome = outcome;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
