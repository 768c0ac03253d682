package com.jobrelay.engine;

import com.jobrelay.CronDefinition;
import com.jobrelay.CronDefinitionRepository;
import com.jobrelay.Job;
import com.jobrelay.JobRepository;
import com.jobrelay.MisfirePolicy;
import com.jobrelay.config.JobRelayProperties;
import com.jobrelay.exception.InvalidCronScheduleException;
import com.jobrelay.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Turns due cron definitions into jobs.
 * <p>
 * Each firing is one transaction that first advances {@code next_fire_at} with a guard on the value it observed
 * and then inserts the job, so a firing is materialized exactly once even with several schedulers running.
 * Schedules are Spring six-field cron expressions evaluated in UTC.
 */
@Component
public class CronScheduler {

    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private final CronDefinitionRepository cronDefinitionRepository;
    private final JobRepository jobRepository;
    private final TransactionTemplate transactionTemplate;
    private final JobRelayProperties properties;
    private final Clock clock;

    public CronScheduler(
            CronDefinitionRepository cronDefinitionRepository,
            JobRepository jobRepository,
            TransactionTemplate transactionTemplate,
            JobRelayProperties properties,
            Clock jobRelayClock) {
        this.cronDefinitionRepository = cronDefinitionRepository;
        this.jobRepository = jobRepository;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = jobRelayClock;
    }

    /**
     * Parses a schedule, rejecting it with {@link InvalidCronScheduleException} if it is not a valid expression.
     */
    public static CronExpression parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new InvalidCronScheduleException(schedule, null);
        }
        try {
            return CronExpression.parse(schedule.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidCronScheduleException(schedule, e);
        }
    }

    /**
     * First firing of {@code schedule} strictly after {@code after}.
     */
    public static OffsetDateTime nextFireAfter(CronExpression expression, OffsetDateTime after) {
        return expression.next(after.withOffsetSameInstant(ZoneOffset.UTC));
    }

    @Scheduled(fixedDelayString = "${jobrelay.cron.tick-interval-in-seconds:1}000")
    public void tick() {
        if (!properties.getCron().isEnabled()) {
            return;
        }
        try {
            int created = evaluate(OffsetDateTime.now(clock));
            if (created > 0) {
                log.info("Cron scheduler materialized {} jobs", created);
            }
        } catch (StoreUnavailableException e) {
            log.warn("Skipping cron tick: {}", e.getMessage());
        }
    }

    /**
     * @return number of jobs created
     * @throws StoreUnavailableException if the store cannot be reached; firings already committed stay committed
     */
    public int evaluate(OffsetDateTime now) {
        List<CronDefinition> due;
        try {
            due = cronDefinitionRepository.findDue(now);
        } catch (RuntimeException e) {
            throw StoreFailures.translate("cron scan", e);
        }

        int created = 0;
        for (CronDefinition definition : due) {
            CronExpression expression;
            try {
                expression = parse(definition.getSchedule());
            } catch (InvalidCronScheduleException e) {
                log.error("Cron definition {} holds an unparseable schedule '{}'; skipping it", definition.getId(),
                        definition.getSchedule(), e);
                continue;
            }
            created += definition.getMisfirePolicy() == MisfirePolicy.BACKFILL
                    ? backfill(definition, expression, now)
                    : collapse(definition, expression, now);
        }
        return created;
    }

    private int collapse(CronDefinition definition, CronExpression expression, OffsetDateTime now) {
        OffsetDateTime fired = definition.getNextFireAt();
        OffsetDateTime reference = fired.isAfter(now) ? fired : now;
        OffsetDateTime next = nextFireAfter(expression, reference);
        if (next == null) {
            log.warn("Cron definition {} has no firing after {}; leaving it in place", definition.getId(), reference);
            return 0;
        }
        return fire(definition, fired, next, now) == Firing.CREATED ? 1 : 0;
    }

    private int backfill(CronDefinition definition, CronExpression expression, OffsetDateTime now) {
        int limit = Math.max(1, properties.getCron().getMaxBackfillPerTick());
        OffsetDateTime fired = definition.getNextFireAt();
        int steps = 0;
        int created = 0;
        while (steps < limit && !fired.isAfter(now)) {
            OffsetDateTime next = nextFireAfter(expression, fired);
            if (next == null) {
                log.warn("Cron definition {} has no firing after {}; leaving it in place", definition.getId(), fired);
                break;
            }
            Firing firing = fire(definition, fired, next, now);
            if (firing == Firing.LOST) {
                break;
            }
            if (firing == Firing.CREATED) {
                created++;
            }
            steps++;
            fired = next;
        }
        if (steps == limit && !fired.isAfter(now)) {
            log.info("Cron definition {} is still behind after {} backfilled firings; continuing next tick",
                    definition.getId(), steps);
        }
        return created;
    }

    private Firing fire(CronDefinition definition, OffsetDateTime fired, OffsetDateTime next, OffsetDateTime now) {
        try {
            Firing firing = transactionTemplate.execute(status -> {
                int advanced = cronDefinitionRepository.advance(definition.getId(), fired, next, now);
                if (advanced == 0) {
                    return Firing.LOST;
                }
                // the slot can already hold a job if an edit moved next_fire_at back onto a fired instant
                if (jobRepository.existsByCronDefinitionIdAndScheduledFireAt(definition.getId(), fired)) {
                    return Firing.ALREADY_MATERIALIZED;
                }
                jobRepository.saveAndFlush(materialize(definition, fired, now));
                return Firing.CREATED;
            });
            if (firing == Firing.CREATED) {
                log.debug("Cron definition {} fired for {}; next firing at {}", definition.getId(), fired, next);
                return firing;
            }
            if (firing == Firing.ALREADY_MATERIALIZED) {
                log.debug("Cron definition {} firing at {} already materialized; advanced to {}",
                        definition.getId(), fired, next);
                return firing;
            }
            log.debug("Cron definition {} firing at {} was already handled", definition.getId(), fired);
            return Firing.LOST;
        } catch (DataIntegrityViolationException duplicateFiring) {
            log.debug("Cron definition {} firing at {} already materialized", definition.getId(), fired);
            return Firing.LOST;
        } catch (RuntimeException e) {
            if (StoreFailures.isConflict(e)) {
                log.debug("Cron definition {} firing at {} lost a race: {}", definition.getId(), fired,
                        e.getMessage());
                return Firing.LOST;
            }
            throw StoreFailures.translate("cron firing", e);
        }
    }

    private Job materialize(CronDefinition definition, OffsetDateTime fired, OffsetDateTime now) {
        Job job = new Job(UUID.randomUUID(), definition.getJobType(), definition.getPayload(),
                definition.getPriority(), definition.getMaxAttempts(), now);
        job.setBaseDelayMs(definition.getBaseDelayMs());
        job.setMaxDelayMs(definition.getMaxDelayMs());
        job.setLeaseDurationMs(definition.getLeaseDurationMs());
        job.setRateKey(definition.getRateKey());
        job.setCronDefinitionId(definition.getId());
        job.setScheduledFireAt(fired);
        return job;
    }

    private enum Firing {
        CREATED,
        ALREADY_MATERIALIZED,
        LOST
    }
}
