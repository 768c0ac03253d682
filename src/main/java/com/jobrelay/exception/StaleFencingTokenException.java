package com.jobrelay.exception;

import java.util.UUID;

/**
 * The lease a worker was executing under has been revoked (reaped, reassigned or cancelled). The current
 * execution attempt must stop without any further writes; the job itself has already moved on.
 */
public class StaleFencingTokenException extends JobRelayException {

    private final UUID jobId;
    private final long fencingToken;

    public StaleFencingTokenException(UUID jobId, long fencingToken) {
        super("Lease on job " + jobId + " with fencing token " + fencingToken + " is no longer held");
        this.jobId = jobId;
        this.fencingToken = fencingToken;
    }

    public UUID getJobId() {
        return jobId;
    }

    public long getFencingToken() {
        return fencingToken;
    }
}
