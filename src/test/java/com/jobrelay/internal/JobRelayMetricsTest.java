package com.jobrelay.internal;

import com.jobrelay.JobRepository;
import com.jobrelay.JobState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobRelayMetricsTest {

    private JobRepository jobRepository;
    private MeterRegistry meterRegistry;
    private JobRelayMetrics metrics;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        metrics = new JobRelayMetrics(jobRepository, meterRegistry);
    }

    @Test
    void shouldRegisterStateGaugesAndQueueDepthFromOneSnapshot() {
        when(jobRepository.countByStates()).thenReturn(List.of(
                count(JobState.PENDING, 10L),
                count(JobState.RETRYING, 3L),
                count(JobState.LEASED, 5L),
                count(JobState.DEAD_LETTERED, 2L)));

        metrics.registerGauges();

        Gauge pending = meterRegistry.find("jobrelay.jobs.count").tag("state", "PENDING").gauge();
        assertThat(pending).isNotNull();
        assertThat(pending.value()).isEqualTo(10.0);

        Gauge completed = meterRegistry.find("jobrelay.jobs.count").tag("state", "COMPLETED").gauge();
        assertThat(completed).isNotNull();
        assertThat(completed.value()).isEqualTo(0.0);

        Gauge depth = meterRegistry.find("jobrelay.queue.depth").gauge();
        assertThat(depth).isNotNull();
        assertThat(depth.value()).isEqualTo(13.0);

        verify(jobRepository, times(1)).countByStates();
    }

    @Test
    void shouldReportZeroWhenCountsCannotBeLoaded() {
        when(jobRepository.countByStates()).thenThrow(new IllegalStateException("store down"));

        metrics.registerGauges();

        assertThat(meterRegistry.find("jobrelay.queue.depth").gauge().value()).isEqualTo(0.0);
    }

    @Test
    void shouldIncrementLifecycleCounters() {
        metrics.recordCompleted();
        metrics.recordCompleted();
        metrics.recordFailed();
        metrics.recordDeadLettered();
        metrics.recordCancelled();
        metrics.recordReaped();

        assertThat(meterRegistry.counter("jobrelay.jobs.completed").count()).isEqualTo(2.0);
        assertThat(meterRegistry.counter("jobrelay.jobs.failed").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("jobrelay.jobs.dead_lettered").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("jobrelay.jobs.cancelled").count()).isEqualTo(1.0);
        assertThat(meterRegistry.counter("jobrelay.leases.reaped").count()).isEqualTo(1.0);
    }

    private static JobRepository.StateCount count(JobState state, long total) {
        return new JobRepository.StateCount() {
            @Override
            public JobState getState() {
                return state;
            }

            @Override
            public Long getTotal() {
                return total;
            }
        };
    }
}
