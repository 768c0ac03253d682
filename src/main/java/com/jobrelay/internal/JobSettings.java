package com.jobrelay.internal;

import com.jobrelay.CronDefinition;
import com.jobrelay.Job;

/**
 * Fully resolved, validated settings stamped onto a job or a cron template.
 */
public record JobSettings(
        int priority,
        int maxAttempts,
        long baseDelayMs,
        long maxDelayMs,
        long leaseDurationMs,
        String rateKey) {

    public JobSettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelay must be >= 0");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
        if (leaseDurationMs <= 0) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
    }

    public void applyTo(Job job) {
        job.setPriority(priority);
        job.setMaxAttempts(maxAttempts);
        job.setBaseDelayMs(baseDelayMs);
        job.setMaxDelayMs(maxDelayMs);
        job.setLeaseDurationMs(leaseDurationMs);
        job.setRateKey(rateKey);
    }

    public void applyTo(CronDefinition definition) {
        definition.setPriority(priority);
        definition.setMaxAttempts(maxAttempts);
        definition.setBaseDelayMs(baseDelayMs);
        definition.setMaxDelayMs(maxDelayMs);
        definition.setLeaseDurationMs(leaseDurationMs);
        definition.setRateKey(rateKey);
    }
}
