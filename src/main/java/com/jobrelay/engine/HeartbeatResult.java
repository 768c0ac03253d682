package com.jobrelay.engine;

import java.time.OffsetDateTime;

public record HeartbeatResult(Status status, OffsetDateTime expiresAt) {

    public enum Status {
        /** Lease extended to {@link #expiresAt()}. */
        RENEWED,
        /** Stale token or wrong owner. The worker must stop and write nothing further. */
        REJECTED,
        /** Cancellation was requested; the job is now {@code CANCELLED} and the worker must stop. */
        CANCELLED
    }

    private static final HeartbeatResult REJECTED_RESULT = new HeartbeatResult(Status.REJECTED, null);
    private static final HeartbeatResult CANCELLED_RESULT = new HeartbeatResult(Status.CANCELLED, null);

    public static HeartbeatResult renewed(OffsetDateTime expiresAt) {
        return new HeartbeatResult(Status.RENEWED, expiresAt);
    }

    public static HeartbeatResult rejected() {
        return REJECTED_RESULT;
    }

    public static HeartbeatResult cancelled() {
        return CANCELLED_RESULT;
    }

    public boolean isRenewed() {
        return status == Status.RENEWED;
    }
}
