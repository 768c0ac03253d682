package com.jobrelay.engine;

import com.jobrelay.Job;
import com.jobrelay.JobRepository;
import com.jobrelay.JobRunOutcome;
import com.jobrelay.JobRunRepository;
import com.jobrelay.config.JobRelayProperties;
import com.jobrelay.exception.StoreUnavailableException;
import com.jobrelay.internal.JobRelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Reclaims jobs whose lease ran out without a heartbeat. An expired lease counts as a failed attempt; a job whose
 * cancellation was requested is cancelled instead.
 */
@Component
public class Reaper {

    private static final Logger log = LoggerFactory.getLogger(Reaper.class);

    private final JobRepository jobRepository;
    private final JobRunRepository jobRunRepository;
    private final RetryEngine retryEngine;
    private final TransactionTemplate transactionTemplate;
    private final JobRelayProperties properties;
    private final Clock clock;
    private final ObjectProvider<JobRelayMetrics> metrics;

    public Reaper(
            JobRepository jobRepository,
            JobRunRepository jobRunRepository,
            RetryEngine retryEngine,
            TransactionTemplate transactionTemplate,
            JobRelayProperties properties,
            Clock jobRelayClock,
            ObjectProvider<JobRelayMetrics> metrics) {
        this.jobRepository = jobRepository;
        this.jobRunRepository = jobRunRepository;
        this.retryEngine = retryEngine;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = jobRelayClock;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "${jobrelay.reaper.interval-in-seconds:5}000")
    public void scheduledReap() {
        if (!properties.getReaper().isEnabled()) {
            return;
        }
        try {
            int reclaimed = reap(OffsetDateTime.now(clock));
            if (reclaimed > 0) {
                log.info("Reaper reclaimed {} expired leases", reclaimed);
            }
        } catch (StoreUnavailableException e) {
            log.warn("Skipping reaper pass: {}", e.getMessage());
        }
    }

    /**
     * @return number of jobs moved out of {@code LEASED}
     * @throws StoreUnavailableException if the store cannot be reached; jobs already reclaimed stay reclaimed
     */
    public int reap(OffsetDateTime now) {
        int batchSize = Math.max(1, properties.getReaper().getBatchSize());
        int reclaimed = 0;
        while (true) {
            List<Job> expired;
            try {
                expired = jobRepository.findExpiredLeases(now, PageRequest.of(0, batchSize));
            } catch (RuntimeException e) {
                throw StoreFailures.translate("reaper scan", e);
            }

            int reclaimedInBatch = 0;
            for (Job job : expired) {
                if (reclaim(job, now)) {
                    reclaimedInBatch++;
                }
            }
            reclaimed += reclaimedInBatch;

            if (expired.size() < batchSize || reclaimedInBatch == 0) {
                return reclaimed;
            }
        }
    }

    private boolean reclaim(Job job, OffsetDateTime now) {
        boolean cancel = job.isCancelRequested();
        RetryDecision decision = cancel
                ? retryEngine.onCancellation(job, "Lease expired after cancellation was requested", now)
                : retryEngine.onFailure(job, "Lease held by " + job.getLeaseOwner() + " expired at "
                        + job.getLeaseExpiresAt() + " without a heartbeat", now);

        Boolean updated;
        try {
            updated = transactionTemplate.execute(status -> {
                int rows = jobRepository.expireLease(
                        job.getId(),
                        job.getFencingToken(),
                        job.getAttemptCount(),
                        cancel,
                        decision.nextState(),
                        decision.nextAttemptCount(),
                        decision.notBefore(),
                        decision.lastError(),
                        decision.finishedAt(),
                        now);
                if (rows == 0) {
                    return false;
                }
                jobRunRepository.close(job.getId(), job.getFencingToken(),
                        cancel ? JobRunOutcome.CANCELLED : JobRunOutcome.EXPIRED, decision.lastError(), now);
                return true;
            });
        } catch (RuntimeException e) {
            if (StoreFailures.isConflict(e)) {
                log.debug("Reaping job {} lost a race: {}", job.getId(), e.getMessage());
                return false;
            }
            throw StoreFailures.translate("reap", e);
        }

        if (!Boolean.TRUE.equals(updated)) {
            log.debug("Job {} was renewed or settled before it could be reaped", job.getId());
            return false;
        }

        metrics.ifAvailable(JobRelayMetrics::recordReaped);
        switch (decision.nextState()) {
            case CANCELLED -> {
                metrics.ifAvailable(JobRelayMetrics::recordCancelled);
                log.info("Cancelled job {} after its lease expired", job.getId());
            }
            case DEAD_LETTERED -> {
                metrics.ifAvailable(m -> {
                    m.recordFailed();
                    m.recordDeadLettered();
                });
                log.warn("Job {} dead-lettered after its lease expired on attempt {}", job.getId(),
                        decision.nextAttemptCount());
            }
            default -> {
                metrics.ifAvailable(JobRelayMetrics::recordFailed);
                log.debug("Job {} requeued after its lease expired; eligible again at {}", job.getId(),
                        decision.notBefore());
            }
        }
        return true;
    }
}
