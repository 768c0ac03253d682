package com.jobrelay;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Shared context over the embedded H2 store. Tables are emptied before every test.
 */
@SpringBootTest(classes = TestApplication.class)
@ActiveProfiles("test")
public abstract class StoreBackedTest {

    protected static final OffsetDateTime T0 = OffsetDateTime.of(2030, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected JobRepository jobRepository;

    @BeforeEach
    void cleanStore() {
        jdbcTemplate.update("DELETE FROM jobrelay_job_runs");
        jdbcTemplate.update("DELETE FROM jobrelay_jobs");
        jdbcTemplate.update("DELETE FROM jobrelay_cron_definitions");
        jdbcTemplate.update("DELETE FROM jobrelay_rate_buckets");
        jdbcTemplate.update("DELETE FROM jobrelay_workers");
    }

    /**
     * Inserts a pending job created at {@code createdAt} and eligible from then on.
     */
    protected Job insertJob(String type, int priority, OffsetDateTime createdAt) {
        Job job = new Job(UUID.randomUUID(), type, JsonNodeFactory.instance.objectNode().put("type", type), priority,
                3, createdAt);
        job.setBaseDelayMs(1_000);
        job.setMaxDelayMs(60_000);
        job.setLeaseDurationMs(30_000);
        return jobRepository.saveAndFlush(job);
    }

    protected Job reload(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow();
    }
}
