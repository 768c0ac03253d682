package com.jobrelay;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

/**
 * A recurrence rule plus the template stamped onto every job it materializes.
 */
@Entity
@Table(name = "jobrelay_cron_definitions")
public class CronDefinition {

    @Id
    private String id;

    // Schedule state below is written only by guarded updates in CronDefinitionRepository.
    @Column(name = "schedule", nullable = false, updatable = false)
    private String schedule;

    @Column(name = "job_type", nullable = false)
    private String jobType;

    @Convert(converter = JsonPayloadConverter.class)
    @Column(name = "payload")
    private JsonNode payload;

    @Column(name = "priority", nullable = false)
    private int priority = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 3;

    @Column(name = "base_delay_ms", nullable = false)
    private long baseDelayMs = 1000L;

    @Column(name = "max_delay_ms", nullable = false)
    private long maxDelayMs = 300_000L;

    @Column(name = "lease_duration_ms", nullable = false)
    private long leaseDurationMs = 30_000L;

    @Column(name = "rate_key")
    private String rateKey;

    @Column(name = "next_fire_at", nullable = false, updatable = false)
    private OffsetDateTime nextFireAt;

    @Column(name = "last_fired_at", updatable = false)
    private OffsetDateTime lastFiredAt;

    @Column(name = "enabled", nullable = false, updatable = false)
    private boolean enabled = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "misfire_policy", nullable = false)
    private MisfirePolicy misfirePolicy = MisfirePolicy.COLLAPSE;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public CronDefinition() {
    }

    public CronDefinition(String id, String schedule, String jobType) {
        this.id = id;
        this.schedule = schedule;
        this.jobType = jobType;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSchedule() {
        return schedule;
    }

    public void setSchedule(String schedule) {
        this.schedule = schedule;
    }

    public String getJobType() {
        return jobType;
    }

    public void setJobType(String jobType) {
        this.jobType = jobType;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
        this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = maxDelayMs;
    }

    public long getLeaseDurationMs() {
        return leaseDurationMs;
    }

    public void setLeaseDurationMs(long leaseDurationMs) {
        this.leaseDurationMs = leaseDurationMs;
    }

    public String getRateKey() {
        return rateKey;
    }

    public void setRateKey(String rateKey) {
        this.rateKey = rateKey;
    }

    public OffsetDateTime getNextFireAt() {
        return nextFireAt;
    }

    public void setNextFireAt(OffsetDateTime nextFireAt) {
        this.nextFireAt = nextFireAt;
    }

    public OffsetDateTime getLastFiredAt() {
        return lastFiredAt;
    }

    public void setLastFiredAt(OffsetDateTime lastFiredAt) {
        this.lastFiredAt = lastFiredAt;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public MisfirePolicy getMisfirePolicy() {
        return misfirePolicy;
    }

    public void setMisfirePolicy(MisfirePolicy misfirePolicy) {
        this.misfirePolicy = misfirePolicy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
