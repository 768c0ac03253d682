package com.jobrelay.internal;

import com.jobrelay.JobOptions;
import com.jobrelay.JobWorker;
import com.jobrelay.MisfirePolicy;
import com.jobrelay.config.JobRelayProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-type defaults declared with {@code @Job} on worker beans, and the resolution of submission options against
 * them and the global {@code jobrelay.jobs.*} defaults.
 */
@Component
public class JobTypeMetadataRegistry {

    private final List<JobWorker<?>> workers;
    private final JobRelayProperties properties;
    private volatile Map<String, JobTypeMetadata> metadataByType = Map.of();

    public JobTypeMetadataRegistry(List<JobWorker<?>> workers, JobRelayProperties properties) {
        this.workers = workers;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        Map<String, JobTypeMetadata> metadata = new LinkedHashMap<>();
        for (JobWorker<?> worker : workers) {
            String source = "JobWorker bean " + ClassUtils.getUserClass(worker).getName();
            String jobType = normalizeRequiredType(worker.getJobType(), source);
            com.jobrelay.annotation.Job annotation = AnnotationUtils.findAnnotation(ClassUtils.getUserClass(worker),
                    com.jobrelay.annotation.Job.class);
            JobTypeMetadata entry = annotation == null ? JobTypeMetadata.NONE : JobTypeMetadata.from(annotation);
            JobTypeMetadata existing = metadata.putIfAbsent(jobType, entry);
            if (existing != null && !existing.equals(entry)) {
                throw new IllegalStateException("Job type '" + jobType
                        + "' has conflicting @Job settings while scanning " + source + ".");
            }
        }
        metadataByType = Map.copyOf(metadata);
    }

    public Optional<JobTypeMetadata> metadataFor(String jobType) {
        return Optional.ofNullable(metadataByType.get(jobType));
    }

    public Map<String, JobTypeMetadata> all() {
        return metadataByType;
    }

    /**
     * Resolves the settings for a job of {@code jobType}: explicit options first, then {@code @Job}, then the global
     * defaults.
     */
    public JobSettings resolve(String jobType, JobOptions options) {
        JobOptions explicit = options == null ? JobOptions.defaults() : options;
        JobTypeMetadata typeDefaults = metadataByType.getOrDefault(jobType, JobTypeMetadata.NONE);
        JobRelayProperties.Jobs globalDefaults = properties.getJobs();

        int priority = explicit.priority() != null ? explicit.priority() : typeDefaults.priority();
        int maxAttempts = explicit.maxAttempts() != null ? explicit.maxAttempts()
                : typeDefaults.maxAttempts() >= 0 ? typeDefaults.maxAttempts() : globalDefaults.getDefaultMaxAttempts();
        long baseDelayMs = millis(explicit.baseDelay(), typeDefaults.baseDelayMs(),
                globalDefaults.getDefaultBaseDelay());
        long maxDelayMs = millis(explicit.maxDelay(), typeDefaults.maxDelayMs(), globalDefaults.getDefaultMaxDelay());
        long leaseDurationMs = millis(explicit.leaseDuration(), typeDefaults.leaseDurationMs(),
                globalDefaults.getDefaultLeaseDuration());
        String rateKey = explicit.rateKey() != null ? blankToNull(explicit.rateKey()) : typeDefaults.rateKey();

        return new JobSettings(priority, maxAttempts, baseDelayMs, maxDelayMs, leaseDurationMs, rateKey);
    }

    private static long millis(Duration explicit, long typeDefaultMs, Duration globalDefault) {
        if (explicit != null) {
            return explicit.toMillis();
        }
        return typeDefaultMs >= 0 ? typeDefaultMs : globalDefault.toMillis();
    }

    private static String normalizeRequiredType(String type, String source) {
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalStateException("Job type must not be blank for " + source);
        }
        return type.trim();
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * {@code -1} means "not declared".
     */
    public record JobTypeMetadata(
            String cron,
            MisfirePolicy misfirePolicy,
            int maxAttempts,
            long baseDelayMs,
            long maxDelayMs,
            long leaseDurationMs,
            int priority,
            String rateKey) {

        static final JobTypeMetadata NONE = new JobTypeMetadata(null, MisfirePolicy.COLLAPSE, -1, -1L, -1L, -1L, 0,
                null);

        static JobTypeMetadata from(com.jobrelay.annotation.Job annotation) {
            return new JobTypeMetadata(
                    blankToNull(annotation.cron()),
                    annotation.misfirePolicy(),
                    annotation.maxAttempts(),
                    annotation.baseDelayMs(),
                    annotation.maxDelayMs(),
                    annotation.leaseDurationMs(),
                    annotation.priority(),
                    blankToNull(annotation.rateKey()));
        }
    }
}
