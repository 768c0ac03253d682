package com.jobrelay;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Read-only view of a job at the moment it was loaded.
 */
public record JobSnapshot(
        UUID id,
        String type,
        JsonNode payload,
        int priority,
        JobState state,
        int attemptCount,
        int maxAttempts,
        OffsetDateTime notBefore,
        String rateKey,
        String leaseOwner,
        OffsetDateTime leaseExpiresAt,
        long fencingToken,
        boolean cancelRequested,
        String cronDefinitionId,
        OffsetDateTime scheduledFireAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime finishedAt,
        String lastError) {

    public static JobSnapshot of(Job job) {
        return new JobSnapshot(
                job.getId(),
                job.getType(),
                job.getPayload(),
                job.getPriority(),
                job.getState(),
                job.getAttemptCount(),
                job.getMaxAttempts(),
                job.getNotBefore(),
                job.getRateKey(),
                job.getLeaseOwner(),
                job.getLeaseExpiresAt(),
                job.getFencingToken(),
                job.isCancelRequested(),
                job.getCronDefinitionId(),
                job.getScheduledFireAt(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getFinishedAt(),
                job.getLastError());
    }
}
