package com.jobrelay.engine;

import com.jobrelay.Job;
import com.jobrelay.JobState;
import com.jobrelay.StoreBackedTest;
import com.jobrelay.ratelimit.RateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatcherTest extends StoreBackedTest {

    @Autowired
    Dispatcher dispatcher;

    @Autowired
    RateLimiter rateLimiter;

    @Test
    void shouldDispatchByPriorityThenAge() {
        Job a = insertJob("REPORT", 5, T0.plusSeconds(1));
        Job b = insertJob("REPORT", 5, T0.plusSeconds(2));
        Job c = insertJob("REPORT", 9, T0.plusSeconds(3));
        OffsetDateTime now = T0.plusSeconds(10);

        assertEquals(c.getId(), dispatchedJobId(now));
        assertEquals(a.getId(), dispatchedJobId(now));
        assertEquals(b.getId(), dispatchedJobId(now));
        assertTrue(dispatcher.dispatch("worker-a", List.of(), now).isEmpty());
    }

    @Test
    void shouldNotSelectJobsBeforeNotBefore() {
        Job future = insertJob("REPORT", 9, T0.plusMinutes(5));
        Job ready = insertJob("REPORT", 1, T0);

        Optional<Job> next = dispatcher.nextReady(List.of(), T0.plusSeconds(1));

        assertEquals(ready.getId(), next.orElseThrow().getId());
        assertEquals(JobState.PENDING, reload(future.getId()).getState());
        assertEquals(JobState.PENDING, reload(ready.getId()).getState());
    }

    @Test
    void shouldOnlyDispatchRequestedTypes() {
        insertJob("REPORT", 9, T0);
        Job email = insertJob("EMAIL", 1, T0);

        Lease lease = dispatcher.dispatch("worker-a", List.of("EMAIL"), T0.plusSeconds(1)).orElseThrow();

        assertEquals(email.getId(), lease.jobId());
        assertEquals("EMAIL", lease.type());
    }

    @Test
    void shouldSkipJobsWhoseRateKeyIsExhaustedWithoutBlockingOthers() {
        rateLimiter.configure("partner-api", 1, 0, T0);
        Job first = insertJob("SYNC", 9, T0, "partner-api");
        Job throttled = insertJob("SYNC", 9, T0.plusSeconds(1), "partner-api");
        Job unthrottled = insertJob("SYNC", 1, T0.plusSeconds(2));
        OffsetDateTime now = T0.plusSeconds(5);

        assertEquals(first.getId(), dispatchedJobId(now));
        assertEquals(unthrottled.getId(), dispatchedJobId(now));
        assertTrue(dispatcher.dispatch("worker-a", List.of(), now).isEmpty());
        assertEquals(JobState.PENDING, reload(throttled.getId()).getState());
    }

    private UUID dispatchedJobId(OffsetDateTime now) {
        return dispatcher.dispatch("worker-a", List.of(), now).orElseThrow().jobId();
    }

    private Job insertJob(String type, int priority, OffsetDateTime createdAt, String rateKey) {
        Job job = insertJob(type, priority, createdAt);
        job.setRateKey(rateKey);
        return jobRepository.saveAndFlush(job);
    }
}
