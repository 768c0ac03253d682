package com.jobrelay.internal;

import com.jobrelay.JobRepository;
import com.jobrelay.JobState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class JobRelayMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobRelayMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private final Counter completed;
    private final Counter failed;
    private final Counter deadLettered;
    private final Counter cancelled;
    private final Counter leasesReaped;

    private volatile Map<JobState, Long> cachedSnapshot = Map.of();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    public JobRelayMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
        this.completed = Counter.builder("jobrelay.jobs.completed")
                .description("Jobs that finished successfully")
                .register(meterRegistry);
        this.failed = Counter.builder("jobrelay.jobs.failed")
                .description("Failed execution attempts, including those that were dead-lettered")
                .register(meterRegistry);
        this.deadLettered = Counter.builder("jobrelay.jobs.dead_lettered")
                .description("Jobs that exhausted their attempts")
                .register(meterRegistry);
        this.cancelled = Counter.builder("jobrelay.jobs.cancelled")
                .description("Jobs that were cancelled")
                .register(meterRegistry);
        this.leasesReaped = Counter.builder("jobrelay.leases.reaped")
                .description("Expired leases reclaimed by the reaper")
                .register(meterRegistry);
    }

    @PostConstruct
    public void registerGauges() {
        log.info("Micrometer found on classpath. Registering JobRelay gauges...");

        for (JobState state : JobState.values()) {
            Gauge.builder("jobrelay.jobs.count", this, metrics -> metrics.countFor(state))
                    .description("Number of JobRelay jobs")
                    .tag("state", state.name())
                    .register(meterRegistry);
        }

        Gauge.builder("jobrelay.queue.depth", this, JobRelayMetrics::queueDepth)
                .description("Jobs waiting for dispatch (PENDING or RETRYING)")
                .register(meterRegistry);
    }

    public void recordCompleted() {
        completed.increment();
    }

    public void recordFailed() {
        failed.increment();
    }

    public void recordDeadLettered() {
        deadLettered.increment();
    }

    public void recordCancelled() {
        cancelled.increment();
    }

    public void recordReaped() {
        leasesReaped.increment();
    }

    private double countFor(JobState state) {
        return getSnapshot().getOrDefault(state, 0L);
    }

    private double queueDepth() {
        Map<JobState, Long> snapshot = getSnapshot();
        return JobState.DISPATCHABLE.stream().mapToLong(state -> snapshot.getOrDefault(state, 0L)).sum();
    }

    private Map<JobState, Long> getSnapshot() {
        long now = System.nanoTime();
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private Map<JobState, Long> loadSnapshot() {
        try {
            Map<JobState, Long> counts = new EnumMap<>(JobState.class);
            for (JobRepository.StateCount row : jobRepository.countByStates()) {
                if (row.getState() != null) {
                    counts.put(row.getState(), row.getTotal() == null ? 0L : row.getTotal());
                }
            }
            return counts;
        } catch (Exception e) {
            log.trace("Failed to query state counts for metrics: {}", e.getMessage());
            return Map.of();
        }
    }
}
