package com.jobrelay;

public enum JobRunOutcome {
    RUNNING,
    SUCCEEDED,
    FAILED,
    EXPIRED,
    CANCELLED
}
