package com.jobrelay.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A granted lease. {@code fencingToken} must accompany every heartbeat and report made under it.
 *
 * @param attempt 1-based number of the execution this lease covers
 */
public record Lease(
        UUID jobId,
        String type,
        JsonNode payload,
        String workerId,
        long fencingToken,
        OffsetDateTime expiresAt,
        Duration leaseDuration,
        int attempt) {
}
