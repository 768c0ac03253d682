package com.jobrelay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobrelay.engine.CronScheduler;
import com.jobrelay.engine.StoreFailures;
import com.jobrelay.internal.JobSettings;
import com.jobrelay.internal.JobTypeMetadataRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Management of recurring job definitions. Schedules are validated here, so the cron scheduler never sees an
 * expression it cannot evaluate.
 */
@Service
public class CronDefinitionClient {

    private static final Logger log = LoggerFactory.getLogger(CronDefinitionClient.class);

    private final CronDefinitionRepository cronDefinitionRepository;
    private final ObjectMapper objectMapper;
    private final JobTypeMetadataRegistry jobTypeMetadataRegistry;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public CronDefinitionClient(
            CronDefinitionRepository cronDefinitionRepository,
            @Qualifier("jobRelayObjectMapper") ObjectMapper objectMapper,
            JobTypeMetadataRegistry jobTypeMetadataRegistry,
            TransactionTemplate transactionTemplate,
            Clock jobRelayClock) {
        this.cronDefinitionRepository = cronDefinitionRepository;
        this.objectMapper = objectMapper;
        this.jobTypeMetadataRegistry = jobTypeMetadataRegistry;
        this.transactionTemplate = transactionTemplate;
        this.clock = jobRelayClock;
    }

    public CronDefinition define(String id, String schedule, String jobType, Object payload) {
        return define(id, schedule, jobType, payload, MisfirePolicy.COLLAPSE, JobOptions.defaults());
    }

    /**
     * Creates a definition whose first firing is the first match of {@code schedule} after now.
     *
     * @throws IllegalArgumentException if a definition with this id already exists
     * @throws com.jobrelay.exception.InvalidCronScheduleException if the schedule cannot be parsed
     */
    public CronDefinition define(String id, String schedule, String jobType, Object payload,
            MisfirePolicy misfirePolicy, JobOptions options) {
        String definitionId = requireText(id, "Cron definition id");
        String type = requireText(jobType, "Job type");
        CronExpression expression = CronScheduler.parse(schedule);
        JobSettings settings = jobTypeMetadataRegistry.resolve(type, options);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime nextFireAt = requireNextFiring(expression, schedule, now);

        CronDefinition definition = new CronDefinition(definitionId, schedule.trim(), type);
        definition.setPayload(payload != null ? objectMapper.valueToTree(payload) : null);
        settings.applyTo(definition);
        definition.setMisfirePolicy(misfirePolicy != null ? misfirePolicy : MisfirePolicy.COLLAPSE);
        definition.setEnabled(true);
        definition.setNextFireAt(nextFireAt);
        definition.setCreatedAt(now);
        definition.setUpdatedAt(now);

        CronDefinition saved = withStore("cron definition create", () -> transactionTemplate.execute(status -> {
            if (cronDefinitionRepository.existsById(definitionId)) {
                throw new IllegalArgumentException("Cron definition '" + definitionId + "' already exists");
            }
            return cronDefinitionRepository.saveAndFlush(definition);
        }));
        log.info("Defined cron '{}' for job type {} with schedule '{}'; first firing at {}", definitionId, type,
                definition.getSchedule(), nextFireAt);
        return saved;
    }

    /**
     * Changes a definition. {@code null} arguments, and {@code null} fields of {@code options}, keep the current
     * value. A new schedule takes effect from now.
     * <p>
     * Only the columns being changed are written, so an edit never rolls back a firing the scheduler has just
     * recorded.
     *
     * @throws IllegalArgumentException if no definition with this id exists
     */
    public CronDefinition update(String id, String schedule, Object payload, MisfirePolicy misfirePolicy,
            JobOptions options) {
        CronExpression expression = schedule != null ? CronScheduler.parse(schedule) : null;
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime rescheduledAt = expression != null ? requireNextFiring(expression, schedule, now) : null;
        CronDefinition updated = withStore("cron definition update", () -> transactionTemplate.execute(status -> {
            CronDefinition definition = load(id);
            if (payload != null) {
                definition.setPayload(objectMapper.valueToTree(payload));
            }
            if (misfirePolicy != null) {
                definition.setMisfirePolicy(misfirePolicy);
            }
            if (options != null) {
                merge(definition, options).applyTo(definition);
            }
            definition.setUpdatedAt(now);
            cronDefinitionRepository.saveAndFlush(definition);
            if (rescheduledAt != null) {
                cronDefinitionRepository.reschedule(definition.getId(), schedule.trim(), rescheduledAt, now);
            }
            return load(id);
        }));
        log.info("Updated cron '{}'; next firing at {}", updated.getId(), updated.getNextFireAt());
        return updated;
    }

    /**
     * Re-enables a definition. Firings missed while it was disabled are skipped.
     */
    public CronDefinition enable(String id) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return withStore("cron definition enable", () -> transactionTemplate.execute(status -> {
            CronDefinition definition = load(id);
            if (definition.isEnabled()) {
                return definition;
            }
            CronExpression expression = CronScheduler.parse(definition.getSchedule());
            OffsetDateTime nextFireAt = requireNextFiring(expression, definition.getSchedule(), now);
            if (cronDefinitionRepository.enable(definition.getId(), nextFireAt, now) == 1) {
                log.info("Enabled cron '{}'; next firing at {}", definition.getId(), nextFireAt);
            }
            return load(id);
        }));
    }

    public CronDefinition disable(String id) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return withStore("cron definition disable", () -> transactionTemplate.execute(status -> {
            CronDefinition definition = load(id);
            if (!definition.isEnabled()) {
                return definition;
            }
            if (cronDefinitionRepository.disable(definition.getId(), now) == 1) {
                log.info("Disabled cron '{}'", definition.getId());
            }
            return load(id);
        }));
    }

    /**
     * Removes a definition. Jobs it already materialized are left alone.
     *
     * @return {@code false} if there was nothing to delete
     */
    public boolean delete(String id) {
        String definitionId = requireText(id, "Cron definition id");
        Boolean deleted = withStore("cron definition delete", () -> transactionTemplate.execute(status -> {
            if (!cronDefinitionRepository.existsById(definitionId)) {
                return false;
            }
            cronDefinitionRepository.deleteById(definitionId);
            return true;
        }));
        if (Boolean.TRUE.equals(deleted)) {
            log.info("Deleted cron '{}'", definitionId);
            return true;
        }
        return false;
    }

    public Optional<CronDefinition> find(String id) {
        String definitionId = requireText(id, "Cron definition id");
        return withStore("cron definition lookup", () -> cronDefinitionRepository.findById(definitionId));
    }

    public List<CronDefinition> list() {
        return withStore("cron definition list", cronDefinitionRepository::findAllByOrderByIdAsc);
    }

    private CronDefinition load(String id) {
        String definitionId = requireText(id, "Cron definition id");
        return cronDefinitionRepository.findById(definitionId)
                .orElseThrow(() -> new IllegalArgumentException("Cron definition '" + definitionId + "' not found"));
    }

    private static JobSettings merge(CronDefinition definition, JobOptions options) {
        return new JobSettings(
                options.priority() != null ? options.priority() : definition.getPriority(),
                options.maxAttempts() != null ? options.maxAttempts() : definition.getMaxAttempts(),
                millisOr(options.baseDelay(), definition.getBaseDelayMs()),
                millisOr(options.maxDelay(), definition.getMaxDelayMs()),
                millisOr(options.leaseDuration(), definition.getLeaseDurationMs()),
                options.rateKey() != null ? blankToNull(options.rateKey()) : definition.getRateKey());
    }

    private static long millisOr(Duration value, long current) {
        return value != null ? value.toMillis() : current;
    }

    private static String blankToNull(String value) {
        return value.isBlank() ? null : value.trim();
    }

    private static OffsetDateTime requireNextFiring(CronExpression expression, String schedule, OffsetDateTime now) {
        OffsetDateTime next = CronScheduler.nextFireAfter(expression, now);
        if (next == null) {
            throw new IllegalArgumentException("Cron schedule '" + schedule + "' never fires after " + now);
        }
        return next;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value.trim();
    }

    private <T> T withStore(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw StoreFailures.translate(operation, e);
        }
    }
}
