package com.jobrelay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobrelay.engine.StoreFailures;
import com.jobrelay.internal.JobRelayMetrics;
import com.jobrelay.internal.JobSettings;
import com.jobrelay.internal.JobTypeMetadataRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Submission, cancellation and inspection of jobs.
 */
@Service
public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);
    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final JobRepository jobRepository;
    private final JobRunRepository jobRunRepository;
    private final ObjectMapper objectMapper;
    private final JobTypeMetadataRegistry jobTypeMetadataRegistry;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ObjectProvider<JobRelayMetrics> metrics;

    public JobClient(
            JobRepository jobRepository,
            JobRunRepository jobRunRepository,
            @Qualifier("jobRelayObjectMapper") ObjectMapper objectMapper,
            JobTypeMetadataRegistry jobTypeMetadataRegistry,
            TransactionTemplate transactionTemplate,
            Clock jobRelayClock,
            ObjectProvider<JobRelayMetrics> metrics) {
        this.jobRepository = jobRepository;
        this.jobRunRepository = jobRunRepository;
        this.objectMapper = objectMapper;
        this.jobTypeMetadataRegistry = jobTypeMetadataRegistry;
        this.transactionTemplate = transactionTemplate;
        this.clock = jobRelayClock;
        this.metrics = metrics;
    }

    /**
     * Submits a job that is eligible for dispatch immediately, using the defaults of its type.
     */
    public UUID submit(String type, Object payload) {
        return submit(type, payload, JobOptions.defaults());
    }

    public UUID submit(String type, Object payload, JobOptions options) {
        return submitInternal(type, payload, options, null);
    }

    /**
     * Submits a job that becomes eligible for dispatch at {@code notBefore}.
     */
    public UUID submitAt(String type, Object payload, Instant notBefore) {
        return submitAt(type, payload, normalizeRequiredNotBefore(notBefore), JobOptions.defaults());
    }

    public UUID submitAt(String type, Object payload, OffsetDateTime notBefore) {
        return submitAt(type, payload, notBefore, JobOptions.defaults());
    }

    public UUID submitAt(String type, Object payload, OffsetDateTime notBefore, JobOptions options) {
        if (notBefore == null) {
            throw new IllegalArgumentException("notBefore must not be null");
        }
        return submitInternal(type, payload, options, notBefore);
    }

    /**
     * Cancels a job. Jobs waiting for dispatch are cancelled at once; a leased job is only flagged, and the flag is
     * honoured when its worker next heartbeats or reports, or when the lease expires.
     */
    public CancelResult cancel(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId must not be null");
        }
        for (int attempt = 1; attempt <= MAX_CANCEL_ATTEMPTS; attempt++) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            CancelResult result = withStore("cancel", () -> transactionTemplate.execute(status -> {
                if (jobRepository.cancelDispatchable(jobId, now) > 0) {
                    return CancelResult.CANCELLED;
                }
                if (jobRepository.requestCancel(jobId, now) > 0) {
                    return CancelResult.REQUESTED;
                }
                Optional<Job> job = jobRepository.findById(jobId);
                if (job.isEmpty()) {
                    return CancelResult.NOT_FOUND;
                }
                return job.get().getState().isTerminal() ? CancelResult.ALREADY_FINISHED : null;
            }));
            if (result != null) {
                if (result == CancelResult.CANCELLED) {
                    metrics.ifAvailable(JobRelayMetrics::recordCancelled);
                }
                log.debug("Cancel of job {}: {}", jobId, result);
                return result;
            }
        }
        throw new IllegalStateException("Job " + jobId + " kept changing state while being cancelled");
    }

    public Optional<JobSnapshot> getStatus(UUID jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId must not be null");
        }
        return withStore("status lookup", () -> jobRepository.findById(jobId).map(JobSnapshot::of));
    }

    /**
     * Pages through jobs matching {@code filter}, in the order requested by {@code pageable}.
     */
    public Slice<JobSnapshot> list(JobFilter filter, Pageable pageable) {
        JobFilter criteria = filter == null ? JobFilter.all() : filter;
        String type = normalizeOptionalString(criteria.type());
        JobState state = criteria.state();
        return withStore("list", () -> {
            Slice<Job> jobs;
            if (type != null && state != null) {
                jobs = jobRepository.findByTypeAndState(type, state, pageable);
            } else if (type != null) {
                jobs = jobRepository.findByType(type, pageable);
            } else if (state != null) {
                jobs = jobRepository.findByState(state, pageable);
            } else {
                jobs = jobRepository.findAllJobs(pageable);
            }
            return jobs.map(JobSnapshot::of);
        });
    }

    /**
     * Execution history of a job, oldest first.
     */
    public List<JobRun> listRuns(UUID jobId) {
        return withStore("run history lookup", () -> jobRunRepository.findByJobIdOrderByStartedAtAsc(jobId));
    }

    private UUID submitInternal(String type, Object payload, JobOptions options, OffsetDateTime explicitNotBefore) {
        String normalizedType = normalizeRequiredType(type);
        JobSettings settings = jobTypeMetadataRegistry.resolve(normalizedType, options);
        JsonNode jsonPayload = payload != null ? objectMapper.valueToTree(payload) : null;
        OffsetDateTime now = OffsetDateTime.now(clock);

        UUID jobId = UUID.randomUUID();
        Job job = new Job(jobId, normalizedType, jsonPayload, settings.priority(), settings.maxAttempts(), now);
        settings.applyTo(job);
        if (explicitNotBefore != null) {
            job.setNotBefore(explicitNotBefore);
        }
        withStore("submit", () -> jobRepository.save(job));
        log.debug("Submitted job {} of type {} with priority {}", jobId, normalizedType, settings.priority());
        return jobId;
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw StoreFailures.translate(operation, e);
        }
    }

    private String normalizeRequiredType(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        return trimmed;
    }

    private String normalizeOptionalString(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private OffsetDateTime normalizeRequiredNotBefore(Instant notBefore) {
        if (notBefore == null) {
            throw new IllegalArgumentException("notBefore must not be null");
        }
        return OffsetDateTime.ofInstant(notBefore, ZoneOffset.UTC);
    }
}
