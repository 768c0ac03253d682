package com.jobrelay.internal;

import com.jobrelay.JobRepository;
import com.jobrelay.JobState;
import com.jobrelay.config.JobRelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Purges finished jobs past their retention. Run history goes with them.
 */
@Component
@ConditionalOnProperty(prefix = "jobrelay.background-job-server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobCleaner {

    private static final Logger log = LoggerFactory.getLogger(JobCleaner.class);
    private static final Set<JobState> SUCCEEDED = EnumSet.of(JobState.COMPLETED);
    private static final Set<JobState> ABANDONED = EnumSet.of(JobState.DEAD_LETTERED, JobState.CANCELLED);

    private final JobRepository jobRepository;
    private final TransactionTemplate transactionTemplate;
    private final JobRelayProperties properties;
    private final Clock clock;

    public JobCleaner(JobRepository jobRepository, TransactionTemplate transactionTemplate,
            JobRelayProperties properties, Clock jobRelayClock) {
        this.jobRepository = jobRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = jobRelayClock;
    }

    // hourly
    @Scheduled(fixedDelay = 3600000)
    public void cleanup() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        JobRelayProperties.BackgroundJobServer settings = properties.getBackgroundJobServer();
        try {
            purge(SUCCEEDED, settings.getDeleteSucceededJobsAfter(), now);
        } catch (RuntimeException e) {
            log.error("Failed to clean up completed jobs: {}", e.getMessage());
        }
        try {
            purge(ABANDONED, settings.getDeleteDeadLetteredJobsAfter(), now);
        } catch (RuntimeException e) {
            log.error("Failed to clean up dead-lettered and cancelled jobs: {}", e.getMessage());
        }
    }

    /**
     * @return number of jobs deleted; 0 when {@code retention} is empty
     */
    int purge(Set<JobState> states, String retention, OffsetDateTime now) {
        if (retention == null || retention.isBlank()) {
            return 0;
        }
        Duration age = parseDuration(retention);
        OffsetDateTime threshold = now.minus(age);
        Integer deleted = transactionTemplate.execute(status -> jobRepository.deleteFinishedBefore(states, threshold));
        int count = deleted == null ? 0 : deleted;
        if (count > 0) {
            log.info("Cleaned up {} jobs in {} finished more than {} ago", count, states, age);
        }
        return count;
    }

    static Duration parseDuration(String value) {
        String trimmed = value.trim();
        try {
            return Duration.parse(trimmed);
        } catch (RuntimeException ignored) {
            // shorthand below
        }

        // "36h", "7d", "30m"
        String shorthand = trimmed.toLowerCase(Locale.ROOT);
        try {
            long amount = Long.parseLong(shorthand.substring(0, shorthand.length() - 1));
            if (shorthand.endsWith("m")) {
                return Duration.ofMinutes(amount);
            } else if (shorthand.endsWith("h")) {
                return Duration.ofHours(amount);
            } else if (shorthand.endsWith("d")) {
                return Duration.ofDays(amount);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported duration value: " + value, e);
        }
        throw new IllegalArgumentException("Unsupported duration value: " + value);
    }
}
