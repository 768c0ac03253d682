package com.jobrelay;

import java.time.Duration;

/**
 * Per-submission settings. Unset ({@code null}) values fall back to the {@code @Job} defaults of the job type and
 * then to {@code jobrelay.jobs.*}.
 */
public record JobOptions(
        Integer priority,
        Integer maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Duration leaseDuration,
        String rateKey) {

    private static final JobOptions DEFAULTS = new JobOptions(null, null, null, null, null, null);

    public static JobOptions defaults() {
        return DEFAULTS;
    }

    public JobOptions withPriority(int value) {
        return new JobOptions(value, maxAttempts, baseDelay, maxDelay, leaseDuration, rateKey);
    }

    public JobOptions withMaxAttempts(int value) {
        return new JobOptions(priority, value, baseDelay, maxDelay, leaseDuration, rateKey);
    }

    public JobOptions withBackoff(Duration base, Duration max) {
        return new JobOptions(priority, maxAttempts, base, max, leaseDuration, rateKey);
    }

    public JobOptions withLeaseDuration(Duration value) {
        return new JobOptions(priority, maxAttempts, baseDelay, maxDelay, value, rateKey);
    }

    public JobOptions withRateKey(String value) {
        return new JobOptions(priority, maxAttempts, baseDelay, maxDelay, leaseDuration, value);
    }
}
