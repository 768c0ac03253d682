package com.jobrelay.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.jobrelay.JobContext;
import com.jobrelay.JobWorker;
import com.jobrelay.config.JobRelayProperties;
import com.jobrelay.engine.Dispatcher;
import com.jobrelay.engine.HeartbeatResult;
import com.jobrelay.engine.JobOutcome;
import com.jobrelay.engine.Lease;
import com.jobrelay.engine.LeaseManager;
import com.jobrelay.engine.ReportResult;
import com.jobrelay.exception.StaleFencingTokenException;
import com.jobrelay.exception.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process worker runtime: pulls leases for the job types of the registered {@link JobWorker} beans, runs them
 * on a bounded pool and keeps their leases alive until the outcome is reported.
 */
@Component
@ConditionalOnProperty(prefix = "jobrelay.background-job-server", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobPoller {

    private static final Logger log = LoggerFactory.getLogger(JobPoller.class);
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final Dispatcher dispatcher;
    private final LeaseManager leaseManager;
    private final WorkerRegistry workerRegistry;
    private final List<JobWorker<?>> workers;
    private final ObjectMapper objectMapper;
    private final JobRelayProperties properties;
    private final Clock clock;
    private final int workerCount;
    private final ThreadPoolExecutor processingExecutor;
    private final ScheduledExecutorService heartbeatExecutor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);

    private final String host = resolveHost();
    private final String workerId = host + "-" + UUID.randomUUID();
    private Map<String, RegisteredWorker> workerMap = Map.of();
    private volatile OffsetDateTime pausedUntil;

    public JobPoller(
            Dispatcher dispatcher,
            LeaseManager leaseManager,
            WorkerRegistry workerRegistry,
            List<JobWorker<?>> workers,
            @Qualifier("jobRelayObjectMapper") ObjectMapper objectMapper,
            JobRelayProperties properties,
            Clock jobRelayClock) {
        this.dispatcher = dispatcher;
        this.leaseManager = leaseManager;
        this.workerRegistry = workerRegistry;
        this.workers = workers;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = jobRelayClock;
        this.workerCount = Math.max(1, properties.getBackgroundJobServer().getWorkerCount());

        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workerCount));
        this.heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "jobrelay-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        Map<String, RegisteredWorker> registrations = new LinkedHashMap<>();
        for (JobWorker<?> worker : workers) {
            String jobType = worker.getJobType();
            ObjectReader reader = objectMapper.readerFor(worker.getPayloadClass());
            RegisteredWorker existing = registrations.putIfAbsent(jobType, new RegisteredWorker(jobType, worker, reader));
            if (existing != null) {
                throw new IllegalStateException("Duplicate job type '" + jobType + "' detected while registering "
                        + ClassUtils.getUserClass(worker).getName() + ". Each job type must be unique.");
            }
        }
        this.workerMap = Map.copyOf(registrations);
        log.info("Job poller {} initialized with {} registered job types: {}", workerId, workerMap.size(),
                workerMap.keySet());
    }

    public String getWorkerId() {
        return workerId;
    }

    public Set<String> getRegisteredJobTypes() {
        return workerMap.keySet();
    }

    @Scheduled(fixedDelayString = "${jobrelay.background-job-server.poll-interval-in-seconds:15}000")
    public void poll() {
        if (workerMap.isEmpty() || !pollInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            if (pausedUntil != null && now.isBefore(pausedUntil)) {
                return;
            }
            workerRegistry.heartbeat(workerId, host, now);
            fillFreeSlots();
        } catch (StoreUnavailableException e) {
            Duration backoff = Duration.ofSeconds(properties.getBackgroundJobServer().getStoreUnavailableBackoffInSeconds());
            pausedUntil = OffsetDateTime.now(clock).plus(backoff);
            log.warn("Job store unavailable; pausing claims for {}: {}", backoff, e.getMessage());
        } finally {
            pollInProgress.set(false);
        }
    }

    private void fillFreeSlots() {
        while (inFlight.get() < workerCount) {
            Optional<Lease> lease = dispatcher.dispatch(workerId, workerMap.keySet(), OffsetDateTime.now(clock));
            if (lease.isEmpty()) {
                return;
            }
            RegisteredWorker registration = workerMap.get(lease.get().type());
            inFlight.incrementAndGet();
            try {
                processingExecutor.execute(() -> {
                    try {
                        run(lease.get(), registration);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                log.warn("Processing pool rejected job {}; its lease will expire and be retried", lease.get().jobId());
                return;
            }
        }
    }

    private void run(Lease lease, RegisteredWorker registration) {
        RunningJob context = new RunningJob(lease);
        long periodMs = Math.max(1, lease.leaseDuration().toMillis() / 3);
        ScheduledFuture<?> heartbeat = heartbeatExecutor.scheduleAtFixedRate(() -> renew(context), periodMs,
                periodMs, TimeUnit.MILLISECONDS);
        log.debug("Running job {} of type {} (attempt {}, token {})", lease.jobId(), lease.type(), lease.attempt(),
                lease.fencingToken());

        Object payload = null;
        JobOutcome outcome;
        try {
            payload = deserialize(registration, lease.payload());
            invoke(registration, context, payload);
            outcome = JobOutcome.success();
        } catch (StaleFencingTokenException stale) {
            heartbeat.cancel(false);
            log.debug("Job {} stopped after losing its lease", lease.jobId());
            return;
        } catch (Exception e) {
            heartbeat.cancel(false);
            invokeOnErrorSafely(registration, context, payload, e);
            if (context.isAbandoned()) {
                log.debug("Job {} failed after its lease was lost; not reporting", lease.jobId());
                return;
            }
            log.error("Failed to process job {} of type {}", lease.jobId(), lease.type(), e);
            report(context, JobOutcome.failure(e));
            return;
        } finally {
            heartbeat.cancel(false);
        }

        if (context.isAbandoned()) {
            log.debug("Job {} finished after its lease was lost; not reporting", lease.jobId());
            return;
        }
        if (report(context, outcome) == ReportResult.ACKNOWLEDGED) {
            invokeOnSuccessSafely(registration, context, payload);
        }
    }

    private void renew(RunningJob context) {
        if (context.isAbandoned()) {
            return;
        }
        try {
            HeartbeatResult result = leaseManager.heartbeat(context.jobId(), workerId, context.fencingToken(),
                    OffsetDateTime.now(clock));
            switch (result.status()) {
                case RENEWED -> log.trace("Renewed lease on job {} until {}", context.jobId(), result.expiresAt());
                case CANCELLED -> context.abandon(true);
                case REJECTED -> context.abandon(false);
            }
        } catch (StoreUnavailableException e) {
            log.warn("Could not renew lease on job {}: {}", context.jobId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure renewing lease on job {}", context.jobId(), e);
        }
    }

    private ReportResult report(RunningJob context, JobOutcome outcome) {
        try {
            ReportResult result = leaseManager.complete(context.jobId(), workerId, context.fencingToken(), outcome,
                    OffsetDateTime.now(clock));
            if (result == ReportResult.REJECTED) {
                context.abandon(false);
            }
            return result;
        } catch (StoreUnavailableException e) {
            log.warn("Could not report outcome of job {}; its lease will expire: {}", context.jobId(), e.getMessage());
            return ReportResult.REJECTED;
        }
    }

    private Object deserialize(RegisteredWorker registration, JsonNode payload) throws Exception {
        if (payload == null || payload.isNull() || registration.worker().getPayloadClass() == Void.class) {
            return null;
        }
        return registration.reader().readValue(payload);
    }

    @SuppressWarnings("unchecked")
    private static void invoke(RegisteredWorker registration, JobContext context, Object payload) throws Exception {
        ((JobWorker<Object>) registration.worker()).process(context, payload);
    }

    @SuppressWarnings("unchecked")
    private void invokeOnErrorSafely(RegisteredWorker registration, JobContext context, Object payload, Exception error) {
        try {
            ((JobWorker<Object>) registration.worker()).onError(context, payload, error);
        } catch (Exception onErrorFailure) {
            log.error("onError callback failed for job {} of type {}", context.jobId(), registration.type(),
                    onErrorFailure);
        }
    }

    @SuppressWarnings("unchecked")
    private void invokeOnSuccessSafely(RegisteredWorker registration, JobContext context, Object payload) {
        try {
            ((JobWorker<Object>) registration.worker()).onSuccess(context, payload);
        } catch (Exception onSuccessFailure) {
            log.error("onSuccess callback failed for job {} of type {}", context.jobId(), registration.type(),
                    onSuccessFailure);
        }
    }

    private static String resolveHost() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }

    @PreDestroy
    void shutdownExecutors() throws InterruptedException {
        processingExecutor.shutdown();
        if (!processingExecutor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Jobs still running after {}s; their leases will expire", SHUTDOWN_GRACE_SECONDS);
            processingExecutor.shutdownNow();
        }
        heartbeatExecutor.shutdownNow();
    }

    private record RegisteredWorker(String type, JobWorker<?> worker, ObjectReader reader) {
    }

    private final class RunningJob implements JobContext {

        private final Lease lease;
        private final AtomicBoolean abandoned = new AtomicBoolean(false);
        private volatile boolean cancelled;

        RunningJob(Lease lease) {
            this.lease = lease;
        }

        void abandon(boolean dueToCancellation) {
            cancelled = dueToCancellation;
            if (abandoned.compareAndSet(false, true)) {
                log.info("Abandoning job {} ({})", lease.jobId(), dueToCancellation ? "cancelled" : "lease lost");
            }
        }

        @Override
        public UUID jobId() {
            return lease.jobId();
        }

        @Override
        public String jobType() {
            return lease.type();
        }

        @Override
        public int attempt() {
            return lease.attempt();
        }

        @Override
        public long fencingToken() {
            return lease.fencingToken();
        }

        @Override
        public String workerId() {
            return workerId;
        }

        @Override
        public boolean isAbandoned() {
            return abandoned.get();
        }

        @Override
        public boolean isCancellationRequested() {
            return cancelled;
        }
    }
}
