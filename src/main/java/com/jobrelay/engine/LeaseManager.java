package com.jobrelay.engine;

import com.jobrelay.Job;
import com.jobrelay.JobRepository;
import com.jobrelay.JobRun;
import com.jobrelay.JobRunOutcome;
import com.jobrelay.JobRunRepository;
import com.jobrelay.JobState;
import com.jobrelay.internal.JobRelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Grants, renews and settles leases.
 * <p>
 * Every write is a conditional update on the job row that re-checks state, owner and fencing token, so claims
 * from competing dispatchers, heartbeats and the {@link Reaper} can interleave freely. When a conditional write
 * misses although the row read just before said it should hold, the whole step is re-read and retried a few
 * times before giving up.
 */
@Component
public class LeaseManager {

    private static final Logger log = LoggerFactory.getLogger(LeaseManager.class);
    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final JobRepository jobRepository;
    private final JobRunRepository jobRunRepository;
    private final RetryEngine retryEngine;
    private final TransactionTemplate transactionTemplate;
    private final ObjectProvider<JobRelayMetrics> metrics;

    public LeaseManager(
            JobRepository jobRepository,
            JobRunRepository jobRunRepository,
            RetryEngine retryEngine,
            TransactionTemplate transactionTemplate,
            ObjectProvider<JobRelayMetrics> metrics) {
        this.jobRepository = jobRepository;
        this.jobRunRepository = jobRunRepository;
        this.retryEngine = retryEngine;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
    }

    /**
     * Claims the job for {@code workerId} using the job's own lease duration.
     */
    public Optional<Lease> claim(UUID jobId, String workerId, OffsetDateTime now) {
        return claim(jobId, workerId, null, now);
    }

    /**
     * Atomically moves a dispatchable job to {@code LEASED} and issues the next fencing token.
     *
     * @param leaseDuration lease length, or {@code null} for the job's own
     * @return the lease, or empty if the job is gone, not dispatchable, not yet due or was claimed by someone
     *         else first
     */
    public Optional<Lease> claim(UUID jobId, String workerId, Duration leaseDuration, OffsetDateTime now) {
        Objects.requireNonNull(jobId, "jobId");
        requireWorkerId(workerId);
        if (leaseDuration != null && (leaseDuration.isZero() || leaseDuration.isNegative())) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }

        Optional<Lease> lease;
        try {
            lease = transactionTemplate.execute(status -> {
                Job job = jobRepository.findById(jobId).orElse(null);
                if (job == null || !JobState.DISPATCHABLE.contains(job.getState())) {
                    return Optional.<Lease>empty();
                }
                Duration duration = leaseDuration != null ? leaseDuration : job.getLeaseDuration();
                long expectedToken = job.getFencingToken();
                long nextToken = expectedToken + 1;
                OffsetDateTime expiresAt = now.plus(duration);
                int updated = jobRepository.claim(jobId, workerId, expiresAt, expectedToken, nextToken, now);
                if (updated == 0) {
                    return Optional.<Lease>empty();
                }
                jobRunRepository.save(new JobRun(UUID.randomUUID(), jobId, workerId, nextToken, now));
                return Optional.of(new Lease(jobId, job.getType(), job.getPayload(), workerId, nextToken, expiresAt,
                        duration, job.getAttemptCount() + 1));
            });
        } catch (RuntimeException e) {
            if (StoreFailures.isConflict(e)) {
                log.debug("Claim of job {} by {} lost a race: {}", jobId, workerId, e.getMessage());
                return Optional.empty();
            }
            throw StoreFailures.translate("claim", e);
        }

        if (lease == null || lease.isEmpty()) {
            log.debug("Claim of job {} by {} rejected", jobId, workerId);
            return Optional.empty();
        }
        log.debug("Job {} leased to {} with fencing token {} until {}", jobId, workerId,
                lease.get().fencingToken(), lease.get().expiresAt());
        return lease;
    }

    /**
     * Extends the lease to {@code now} plus the job's lease duration, or tells the worker to stop.
     */
    public HeartbeatResult heartbeat(UUID jobId, String workerId, long fencingToken, OffsetDateTime now) {
        Objects.requireNonNull(jobId, "jobId");
        requireWorkerId(workerId);

        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Step<HeartbeatResult> step = execute("heartbeat", () -> heartbeatOnce(jobId, workerId, fencingToken, now));
            if (step.retry()) {
                continue;
            }
            if (step.value().status() == HeartbeatResult.Status.CANCELLED) {
                metrics.ifAvailable(JobRelayMetrics::recordCancelled);
                log.info("Job {} cancelled at heartbeat from {}", jobId, workerId);
            } else if (step.value().status() == HeartbeatResult.Status.REJECTED) {
                log.debug("Heartbeat for job {} from {} with token {} rejected", jobId, workerId, fencingToken);
            }
            return step.value();
        }
        log.debug("Heartbeat for job {} from {} kept losing races; rejecting", jobId, workerId);
        return HeartbeatResult.rejected();
    }

    /**
     * Settles the lease with the worker's outcome. Success completes the job, failure goes through the
     * {@link RetryEngine}, and a pending cancellation request wins over both.
     */
    public ReportResult complete(UUID jobId, String workerId, long fencingToken, JobOutcome outcome,
            OffsetDateTime now) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(outcome, "outcome");
        requireWorkerId(workerId);

        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Step<JobState> step = execute("report", () -> completeOnce(jobId, workerId, fencingToken, outcome, now));
            if (step.retry()) {
                continue;
            }
            JobState settled = step.value();
            if (settled == null) {
                log.debug("Report for job {} from {} with token {} rejected; the job has moved on", jobId, workerId,
                        fencingToken);
                return ReportResult.REJECTED;
            }
            recordSettlement(jobId, settled, outcome);
            return ReportResult.ACKNOWLEDGED;
        }
        log.debug("Report for job {} from {} kept losing races; rejecting", jobId, workerId);
        return ReportResult.REJECTED;
    }

    private Step<HeartbeatResult> heartbeatOnce(UUID jobId, String workerId, long fencingToken, OffsetDateTime now) {
        Job job = jobRepository.findById(jobId).orElse(null);
        if (!isHeldBy(job, workerId, fencingToken)) {
            return Step.of(HeartbeatResult.rejected());
        }
        if (job.getLeaseExpiresAt() == null || job.getLeaseExpiresAt().isBefore(now)) {
            // expired but not yet reaped; the reaper owns it now
            return Step.of(HeartbeatResult.rejected());
        }
        if (job.isCancelRequested()) {
            RetryDecision decision = retryEngine.onCancellation(job, "Cancelled while running", now);
            if (release(job, workerId, decision, now) == 0) {
                return Step.again();
            }
            jobRunRepository.close(jobId, fencingToken, JobRunOutcome.CANCELLED, null, now);
            return Step.of(HeartbeatResult.cancelled());
        }
        OffsetDateTime expiresAt = now.plus(job.getLeaseDuration());
        if (jobRepository.renewLease(jobId, workerId, fencingToken, expiresAt, now) == 0) {
            return Step.again();
        }
        return Step.of(HeartbeatResult.renewed(expiresAt));
    }

    private Step<JobState> completeOnce(UUID jobId, String workerId, long fencingToken, JobOutcome outcome,
            OffsetDateTime now) {
        Job job = jobRepository.findById(jobId).orElse(null);
        if (!isHeldBy(job, workerId, fencingToken)) {
            return Step.of(null);
        }

        if (job.isCancelRequested()) {
            RetryDecision decision = retryEngine.onCancellation(job, outcome.error(), now);
            if (release(job, workerId, decision, now) == 0) {
                return Step.again();
            }
            jobRunRepository.close(jobId, fencingToken, JobRunOutcome.CANCELLED, outcome.error(), now);
            return Step.of(JobState.CANCELLED);
        }

        if (outcome.succeeded()) {
            if (jobRepository.markCompleted(jobId, workerId, fencingToken, now) == 0) {
                return Step.again();
            }
            jobRunRepository.close(jobId, fencingToken, JobRunOutcome.SUCCEEDED, null, now);
            return Step.of(JobState.COMPLETED);
        }

        RetryDecision decision = retryEngine.onFailure(job, outcome.error(), now);
        if (release(job, workerId, decision, now) == 0) {
            return Step.again();
        }
        jobRunRepository.close(jobId, fencingToken, JobRunOutcome.FAILED, decision.lastError(), now);
        return Step.of(decision.nextState());
    }

    private int release(Job job, String workerId, RetryDecision decision, OffsetDateTime now) {
        return jobRepository.releaseLease(
                job.getId(),
                workerId,
                job.getFencingToken(),
                job.getAttemptCount(),
                job.isCancelRequested(),
                decision.nextState(),
                decision.nextAttemptCount(),
                decision.notBefore(),
                decision.lastError(),
                decision.finishedAt(),
                now);
    }

    private void recordSettlement(UUID jobId, JobState settled, JobOutcome outcome) {
        switch (settled) {
            case COMPLETED -> {
                metrics.ifAvailable(JobRelayMetrics::recordCompleted);
                log.debug("Job {} completed", jobId);
            }
            case RETRYING -> {
                metrics.ifAvailable(JobRelayMetrics::recordFailed);
                log.debug("Job {} failed and will be retried: {}", jobId, outcome.error());
            }
            case DEAD_LETTERED -> {
                metrics.ifAvailable(m -> {
                    m.recordFailed();
                    m.recordDeadLettered();
                });
                log.warn("Job {} exhausted its attempts and was dead-lettered: {}", jobId, outcome.error());
            }
            case CANCELLED -> {
                metrics.ifAvailable(JobRelayMetrics::recordCancelled);
                log.info("Job {} cancelled at report", jobId);
            }
            default -> throw new IllegalStateException("Unexpected settled state " + settled + " for job " + jobId);
        }
    }

    private <T> Step<T> execute(String operation, Supplier<Step<T>> work) {
        try {
            Step<T> step = transactionTemplate.execute(status -> {
                Step<T> result = work.get();
                if (result.retry()) {
                    status.setRollbackOnly();
                }
                return result;
            });
            return step == null ? Step.again() : step;
        } catch (RuntimeException e) {
            if (StoreFailures.isConflict(e)) {
                log.debug("{} lost a race: {}", operation, e.getMessage());
                return Step.again();
            }
            throw StoreFailures.translate(operation, e);
        }
    }

    private static boolean isHeldBy(Job job, String workerId, long fencingToken) {
        return job != null
                && job.getState() == JobState.LEASED
                && workerId.equals(job.getLeaseOwner())
                && job.getFencingToken() == fencingToken;
    }

    private static void requireWorkerId(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
    }

    private record Step<T>(T value, boolean retry) {

        static <T> Step<T> of(T value) {
            return new Step<>(value, false);
        }

        static <T> Step<T> again() {
            return new Step<>(null, true);
        }
    }
}
