package com.jobrelay;

/**
 * Criteria for {@link JobClient#list(JobFilter, org.springframework.data.domain.Pageable)}. {@code null} fields
 * match everything.
 */
public record JobFilter(String type, JobState state) {

    public static JobFilter all() {
        return new JobFilter(null, null);
    }

    public static JobFilter ofType(String type) {
        return new JobFilter(type, null);
    }

    public static JobFilter inState(JobState state) {
        return new JobFilter(null, state);
    }

    public JobFilter withState(JobState newState) {
        return new JobFilter(type, newState);
    }
}
