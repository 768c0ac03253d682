package com.jobrelay;

public enum CancelResult {
    /** The job was waiting for dispatch and is now {@code CANCELLED}. */
    CANCELLED,
    /** The job is leased; it will be cancelled at the worker's next heartbeat or report, or when its lease expires. */
    REQUESTED,
    /** The job had already reached a terminal state. */
    ALREADY_FINISHED,
    NOT_FOUND
}
