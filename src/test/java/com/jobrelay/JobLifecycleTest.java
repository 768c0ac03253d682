package com.jobrelay;

import com.jobrelay.engine.Dispatcher;
import com.jobrelay.engine.JobOutcome;
import com.jobrelay.engine.Lease;
import com.jobrelay.engine.LeaseManager;
import com.jobrelay.engine.ReportResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.Sort;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobLifecycleTest extends StoreBackedTest {

    private static final List<String> ALL_TYPES = List.of();

    @Autowired
    JobClient jobClient;

    @Autowired
    Dispatcher dispatcher;

    @Autowired
    LeaseManager leaseManager;

    @Test
    void shouldCompleteSubmittedJob() {
        UUID id = jobClient.submit("EMAIL", Map.of("to", "ops@example.com"));

        JobSnapshot submitted = jobClient.getStatus(id).orElseThrow();
        assertEquals(JobState.PENDING, submitted.state());
        assertEquals(3, submitted.maxAttempts());
        assertEquals(0, submitted.attemptCount());
        assertEquals("ops@example.com", submitted.payload().get("to").asText());

        OffsetDateTime now = later(1);
        Lease lease = dispatcher.dispatch("worker-a", ALL_TYPES, now).orElseThrow();
        assertEquals(id, lease.jobId());
        assertEquals(1, lease.attempt());
        assertEquals(JobState.LEASED, jobClient.getStatus(id).orElseThrow().state());

        assertEquals(ReportResult.ACKNOWLEDGED,
                leaseManager.complete(id, "worker-a", lease.fencingToken(), JobOutcome.success(), now.plusSeconds(2)));

        JobSnapshot completed = jobClient.getStatus(id).orElseThrow();
        assertEquals(JobState.COMPLETED, completed.state());
        assertNull(completed.leaseOwner());
        assertNotNull(completed.finishedAt());
        List<JobRun> runs = jobClient.listRuns(id);
        assertEquals(1, runs.size());
        assertEquals(JobRunOutcome.SUCCEEDED, runs.get(0).getOutcome());
        assertEquals("worker-a", runs.get(0).getWorkerId());
    }

    @Test
    void shouldDeadLetterAfterMaxAttemptsFailures() {
        UUID id = jobClient.submit("EMAIL", Map.of("to", "ops@example.com"), JobOptions.defaults()
                .withMaxAttempts(3)
                .withBackoff(Duration.ofSeconds(1), Duration.ofMinutes(5)));

        OffsetDateTime now = later(1);
        for (int attempt = 1; attempt <= 3; attempt++) {
            Lease lease = dispatcher.dispatch("worker-a", ALL_TYPES, now).orElseThrow();
            assertEquals(attempt, lease.attempt());
            leaseManager.complete(id, "worker-a", lease.fencingToken(), JobOutcome.failure("smtp down " + attempt),
                    now.plusSeconds(1));
            JobSnapshot afterFailure = jobClient.getStatus(id).orElseThrow();
            assertEquals(attempt, afterFailure.attemptCount());
            assertEquals(attempt < 3 ? JobState.RETRYING : JobState.DEAD_LETTERED, afterFailure.state());
            now = now.plusMinutes(10);
        }

        JobSnapshot deadLettered = jobClient.getStatus(id).orElseThrow();
        assertEquals("smtp down 3", deadLettered.lastError());
        assertNotNull(deadLettered.finishedAt());
        assertTrue(dispatcher.dispatch("worker-a", ALL_TYPES, now.plusDays(1)).isEmpty());
        assertEquals(3, jobClient.listRuns(id).stream().filter(run -> run.getOutcome() == JobRunOutcome.FAILED).count());
    }

    @Test
    void shouldCancelPendingJobImmediately() {
        UUID id = jobClient.submit("EMAIL", Map.of());

        assertEquals(CancelResult.CANCELLED, jobClient.cancel(id));
        assertEquals(JobState.CANCELLED, jobClient.getStatus(id).orElseThrow().state());
        assertTrue(dispatcher.dispatch("worker-a", ALL_TYPES, later(60)).isEmpty());

        assertEquals(CancelResult.ALREADY_FINISHED, jobClient.cancel(id));
        assertEquals(CancelResult.NOT_FOUND, jobClient.cancel(UUID.randomUUID()));
    }

    @Test
    void shouldOnlyRequestCancellationOfLeasedJob() {
        UUID id = jobClient.submit("EMAIL", Map.of());
        OffsetDateTime now = later(1);
        Lease lease = dispatcher.dispatch("worker-a", ALL_TYPES, now).orElseThrow();

        assertEquals(CancelResult.REQUESTED, jobClient.cancel(id));
        JobSnapshot flagged = jobClient.getStatus(id).orElseThrow();
        assertEquals(JobState.LEASED, flagged.state());
        assertTrue(flagged.cancelRequested());

        leaseManager.complete(id, "worker-a", lease.fencingToken(), JobOutcome.success(), now.plusSeconds(1));
        assertEquals(JobState.CANCELLED, jobClient.getStatus(id).orElseThrow().state());
    }

    @Test
    void shouldHoldScheduledJobUntilItIsDue() {
        OffsetDateTime due = later(3600);
        UUID id = jobClient.submitAt("REPORT", Map.of("day", "monday"), due);

        assertTrue(dispatcher.dispatch("worker-a", ALL_TYPES, due.minusSeconds(1)).isEmpty());
        assertEquals(id, dispatcher.dispatch("worker-a", ALL_TYPES, due).orElseThrow().jobId());
    }

    @Test
    void shouldApplySubmitOptions() {
        UUID id = jobClient.submit("EMAIL", Map.of(), JobOptions.defaults()
                .withPriority(7)
                .withMaxAttempts(5)
                .withLeaseDuration(Duration.ofMinutes(2))
                .withRateKey("smtp"));

        Job job = reload(id);
        assertEquals(7, job.getPriority());
        assertEquals(5, job.getMaxAttempts());
        assertEquals(120_000, job.getLeaseDurationMs());
        assertEquals("smtp", job.getRateKey());
    }

    @Test
    void shouldRejectInvalidSubmissions() {
        assertThrows(IllegalArgumentException.class, () -> jobClient.submit(" ", Map.of()));
        assertThrows(IllegalArgumentException.class,
                () -> jobClient.submit("EMAIL", Map.of(), JobOptions.defaults().withMaxAttempts(0)));
        assertThrows(IllegalArgumentException.class,
                () -> jobClient.submitAt("EMAIL", Map.of(), (OffsetDateTime) null));
        assertTrue(jobRepository.findAll().isEmpty());
    }

    @Test
    void shouldListJobsByTypeAndState() {
        UUID first = jobClient.submit("EMAIL", Map.of());
        UUID second = jobClient.submit("EMAIL", Map.of());
        UUID report = jobClient.submit("REPORT", Map.of());
        jobClient.cancel(second);

        PageRequest page = PageRequest.of(0, 10, Sort.by("createdAt", "id"));
        assertEquals(3, jobClient.list(JobFilter.all(), page).getNumberOfElements());
        assertEquals(2, jobClient.list(JobFilter.ofType("EMAIL"), page).getNumberOfElements());
        assertEquals(List.of(report),
                jobClient.list(JobFilter.ofType("REPORT"), page).map(JobSnapshot::id).getContent());
        assertEquals(List.of(first), jobClient.list(JobFilter.ofType("EMAIL").withState(JobState.PENDING), page)
                .map(JobSnapshot::id).getContent());
        assertEquals(List.of(second), jobClient.list(JobFilter.inState(JobState.CANCELLED), page)
                .map(JobSnapshot::id).getContent());

        Slice<JobSnapshot> firstPage = jobClient.list(JobFilter.all(), PageRequest.of(0, 2, Sort.by("createdAt")));
        assertEquals(2, firstPage.getNumberOfElements());
        assertTrue(firstPage.hasNext());
        assertFalse(jobClient.list(JobFilter.all(), PageRequest.of(1, 2, Sort.by("createdAt"))).hasNext());
    }

    @Test
    void shouldReturnEmptyStatusForUnknownJob() {
        assertTrue(jobClient.getStatus(UUID.randomUUID()).isEmpty());
        assertTrue(jobClient.listRuns(UUID.randomUUID()).isEmpty());
    }

    private static OffsetDateTime later(long seconds) {
        return OffsetDateTime.now(ZoneOffset.UTC).plusSeconds(seconds);
    }
}
