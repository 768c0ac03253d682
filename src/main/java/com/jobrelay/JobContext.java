package com.jobrelay;

import com.jobrelay.exception.StaleFencingTokenException;

import java.util.UUID;

/**
 * What a running {@link JobWorker} knows about the lease it executes under.
 * <p>
 * The runtime renews the lease in the background. Once a renewal is rejected, or a cancellation is honoured, the
 * context is abandoned: the worker should stop at its next {@link #checkpoint()} and nothing it reports afterwards
 * is written.
 */
public interface JobContext {

    UUID jobId();

    String jobType();

    /**
     * 1-based number of this execution.
     */
    int attempt();

    long fencingToken();

    String workerId();

    boolean isAbandoned();

    /**
     * {@code true} if the lease was given up because the job was cancelled.
     */
    boolean isCancellationRequested();

    /**
     * Returns normally while the lease is still held.
     *
     * @throws StaleFencingTokenException once the lease has been lost or the job was cancelled
     */
    default void checkpoint() {
        if (isAbandoned()) {
            throw new StaleFencingTokenException(jobId(), fencingToken());
        }
    }
}
