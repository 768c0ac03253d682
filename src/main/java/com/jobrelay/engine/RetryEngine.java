package com.jobrelay.engine;

import com.jobrelay.Job;
import com.jobrelay.JobState;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Decides where a job goes after a failed attempt or an expired lease.
 */
@Component
public class RetryEngine {

    static final int MAX_ERROR_LENGTH = 4000;

    private final BackoffPolicy backoffPolicy;

    public RetryEngine(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
    }

    public RetryDecision onFailure(Job job, String error, OffsetDateTime now) {
        int nextAttemptCount = job.getAttemptCount() + 1;
        String lastError = truncate(error);
        if (nextAttemptCount >= job.getMaxAttempts()) {
            return new RetryDecision(JobState.DEAD_LETTERED, nextAttemptCount, job.getNotBefore(), lastError, now);
        }
        OffsetDateTime notBefore = backoffPolicy.nextEligibleAt(nextAttemptCount,
                Duration.ofMillis(job.getBaseDelayMs()), Duration.ofMillis(job.getMaxDelayMs()), now);
        return new RetryDecision(JobState.RETRYING, nextAttemptCount, notBefore, lastError, null);
    }

    /**
     * A leased job whose cancellation was requested ends here instead of being retried.
     */
    public RetryDecision onCancellation(Job job, String reason, OffsetDateTime now) {
        return new RetryDecision(JobState.CANCELLED, job.getAttemptCount(), job.getNotBefore(), truncate(reason), now);
    }

    static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
