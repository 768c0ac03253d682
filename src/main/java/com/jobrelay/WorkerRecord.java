package com.jobrelay;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "jobrelay_workers")
public class WorkerRecord {

    @Id
    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "host")
    private String host;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "last_seen_at", nullable = false)
    private OffsetDateTime lastSeenAt;

    public WorkerRecord() {
    }

    public WorkerRecord(String workerId, String host, OffsetDateTime now) {
        this.workerId = workerId;
        this.host = host;
        this.startedAt = now;
        this.lastSeenAt = now;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getHost() {
        return host;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(OffsetDateTime lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }
}
