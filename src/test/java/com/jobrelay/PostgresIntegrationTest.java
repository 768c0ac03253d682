package com.jobrelay;

import com.jobrelay.engine.CronScheduler;
import com.jobrelay.engine.Dispatcher;
import com.jobrelay.engine.JobOutcome;
import com.jobrelay.engine.Lease;
import com.jobrelay.engine.LeaseManager;
import com.jobrelay.engine.Reaper;
import com.jobrelay.engine.ReportResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Runs the claim, reap and cron paths against a real PostgreSQL instance, where competing writers actually
 * contend for row locks.
 */
@SpringBootTest(classes = TestApplication.class)
@Testcontainers(disabledWithoutDocker = true)
class PostgresIntegrationTest extends StoreBackedTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("jobrelay")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    LeaseManager leaseManager;

    @Autowired
    Dispatcher dispatcher;

    @Autowired
    Reaper reaper;

    @Autowired
    CronScheduler cronScheduler;

    @Autowired
    CronDefinitionRepository cronDefinitionRepository;

    @Autowired
    JobClient jobClient;

    @Test
    void shouldGrantExactlyOneOfManyConcurrentClaims() throws Exception {
        Job job = insertJob("EMAIL", 0, T0);
        ExecutorService executor = Executors.newFixedThreadPool(16);
        try {
            List<Callable<Optional<Lease>>> claims = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String workerId = "worker-" + i;
                claims.add(() -> leaseManager.claim(job.getId(), workerId, T0.plusSeconds(1)));
            }
            int granted = 0;
            for (Future<Optional<Lease>> claim : executor.invokeAll(claims)) {
                if (claim.get().isPresent()) {
                    granted++;
                }
            }
            assertEquals(1, granted);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, reload(job.getId()).getFencingToken());
    }

    @Test
    void shouldDispatchEveryJobExactlyOnceAcrossCompetingWorkers() throws Exception {
        for (int i = 0; i < 40; i++) {
            insertJob("EMAIL", i % 3, T0.plusNanos(i * 1000L));
        }
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<List<UUID>>> workers = new ArrayList<>();
            for (int w = 0; w < 8; w++) {
                String workerId = "worker-" + w;
                workers.add(() -> {
                    List<UUID> claimed = new ArrayList<>();
                    while (true) {
                        Optional<Lease> lease = dispatcher.dispatch(workerId, List.of(), T0.plusSeconds(1));
                        if (lease.isPresent()) {
                            claimed.add(lease.get().jobId());
                        } else if (dispatcher.nextReady(List.of(), T0.plusSeconds(1)).isEmpty()) {
                            return claimed;
                        }
                    }
                });
            }
            Set<UUID> seen = new HashSet<>();
            int total = 0;
            for (Future<List<UUID>> result : executor.invokeAll(workers)) {
                for (UUID id : result.get()) {
                    total++;
                    seen.add(id);
                }
            }
            assertEquals(40, seen.size());
            assertEquals(40, total);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldFenceOffWorkerWhoseLeaseWasReaped() {
        Job job = insertJob("EMAIL", 0, T0);
        Lease stale = leaseManager.claim(job.getId(), "worker-a", T0).orElseThrow();

        assertEquals(1, reaper.reap(T0.plusMinutes(1)));
        Lease fresh = dispatcher.dispatch("worker-b", List.of(), T0.plusMinutes(10)).orElseThrow();

        assertEquals(ReportResult.REJECTED,
                leaseManager.complete(job.getId(), "worker-a", stale.fencingToken(), JobOutcome.success(),
                        T0.plusMinutes(11)));
        assertEquals(ReportResult.ACKNOWLEDGED,
                leaseManager.complete(job.getId(), "worker-b", fresh.fencingToken(), JobOutcome.success(),
                        T0.plusMinutes(11)));
        assertEquals(JobState.COMPLETED, reload(job.getId()).getState());
        assertEquals(2, jobClient.listRuns(job.getId()).size());
    }

    @Test
    void shouldMaterializeEachCronFiringOnceUnderConcurrentEvaluation() throws Exception {
        CronDefinition definition = new CronDefinition("ticker", "* * * * * *", "TICK");
        definition.setNextFireAt(T0.plusSeconds(1));
        definition.setMisfirePolicy(MisfirePolicy.BACKFILL);
        definition.setCreatedAt(T0);
        definition.setUpdatedAt(T0);
        cronDefinitionRepository.saveAndFlush(definition);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Integer>> evaluators = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                evaluators.add(() -> cronScheduler.evaluate(T0.plusSeconds(5)));
            }
            int created = 0;
            for (Future<Integer> result : executor.invokeAll(evaluators)) {
                created += result.get();
            }
            assertEquals(5, created);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(5, jobRepository.count());
    }

    @Test
    void shouldCancelPendingJobAndStoreJsonPayload() {
        UUID id = jobClient.submit("EMAIL", Map.of("to", "ops@example.com"));

        assertEquals("ops@example.com", jobClient.getStatus(id).orElseThrow().payload().get("to").asText());
        assertEquals(CancelResult.CANCELLED, jobClient.cancel(id));
        assertNotNull(jobClient.getStatus(id).orElseThrow().finishedAt());
    }
}
