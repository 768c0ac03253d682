package com.jobrelay.internal;

import com.jobrelay.CronDefinitionClient;
import com.jobrelay.JobOptions;
import com.jobrelay.exception.InvalidCronScheduleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Creates a cron definition, named after the job type, for every worker declared with {@code @Job(cron = "...")}
 * that does not have one yet. Existing definitions are left as they are, so edits made at runtime survive restarts.
 */
@Component
public class CronDefinitionInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CronDefinitionInitializer.class);

    private final JobTypeMetadataRegistry jobTypeMetadataRegistry;
    private final CronDefinitionClient cronDefinitionClient;
    private volatile boolean running = false;

    public CronDefinitionInitializer(JobTypeMetadataRegistry jobTypeMetadataRegistry,
            CronDefinitionClient cronDefinitionClient) {
        this.jobTypeMetadataRegistry = jobTypeMetadataRegistry;
        this.cronDefinitionClient = cronDefinitionClient;
    }

    @Override
    public void start() {
        for (Map.Entry<String, JobTypeMetadataRegistry.JobTypeMetadata> entry : jobTypeMetadataRegistry.all().entrySet()) {
            String cron = entry.getValue().cron();
            if (cron != null) {
                bootstrap(entry.getKey(), cron, entry.getValue());
            }
        }
        this.running = true;
    }

    private void bootstrap(String jobType, String cron, JobTypeMetadataRegistry.JobTypeMetadata metadata) {
        try {
            if (cronDefinitionClient.find(jobType).isPresent()) {
                log.debug("Cron definition for job type {} already exists", jobType);
                return;
            }
            cronDefinitionClient.define(jobType, cron, jobType, null, metadata.misfirePolicy(), JobOptions.defaults());
        } catch (InvalidCronScheduleException e) {
            throw new IllegalStateException("Invalid cron expression '" + cron + "' for job type '" + jobType + "'", e);
        } catch (IllegalArgumentException alreadyDefined) {
            log.debug("Cron definition for job type {} was created concurrently", jobType);
        } catch (RuntimeException e) {
            log.error("Failed to bootstrap cron definition for job type {} with schedule '{}'", jobType, cron, e);
        }
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
