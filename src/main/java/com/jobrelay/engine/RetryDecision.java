package com.jobrelay.engine;

import com.jobrelay.JobState;

import java.time.OffsetDateTime;

/**
 * The fields a job takes when it leaves {@code LEASED} without succeeding.
 */
public record RetryDecision(
        JobState nextState,
        int nextAttemptCount,
        OffsetDateTime notBefore,
        String lastError,
        OffsetDateTime finishedAt) {

    public boolean isTerminal() {
        return nextState.isTerminal();
    }
}
