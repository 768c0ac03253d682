package com.jobrelay.internal;

import com.jobrelay.CronDefinition;
import com.jobrelay.CronDefinitionClient;
import com.jobrelay.JobContext;
import com.jobrelay.JobOptions;
import com.jobrelay.JobWorker;
import com.jobrelay.MisfirePolicy;
import com.jobrelay.annotation.Job;
import com.jobrelay.config.JobRelayProperties;
import com.jobrelay.exception.InvalidCronScheduleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CronDefinitionInitializerTest {

    private CronDefinitionClient cronDefinitionClient;

    @BeforeEach
    void setUp() {
        cronDefinitionClient = mock(CronDefinitionClient.class);
    }

    @Job(value = "NIGHTLY_EXPORT", cron = "0 0 2 * * *", misfirePolicy = MisfirePolicy.BACKFILL)
    static class NightlyExportWorker implements JobWorker<Void> {
        @Override
        public void process(JobContext context, Void payload) {
        }
    }

    @Job("ON_DEMAND")
    static class OnDemandWorker implements JobWorker<Void> {
        @Override
        public void process(JobContext context, Void payload) {
        }
    }

    @Job(value = "BROKEN_SCHEDULE", cron = "not-a-cron")
    static class BrokenScheduleWorker implements JobWorker<Void> {
        @Override
        public void process(JobContext context, Void payload) {
        }
    }

    @Test
    void shouldDefineMissingCronDefinitionsForAnnotatedWorkers() {
        when(cronDefinitionClient.find("NIGHTLY_EXPORT")).thenReturn(Optional.empty());

        CronDefinitionInitializer initializer = initializer(new NightlyExportWorker(), new OnDemandWorker());
        initializer.start();

        verify(cronDefinitionClient).define("NIGHTLY_EXPORT", "0 0 2 * * *", "NIGHTLY_EXPORT", null,
                MisfirePolicy.BACKFILL, JobOptions.defaults());
        verify(cronDefinitionClient, never()).find("ON_DEMAND");
        assertTrue(initializer.isRunning());
    }

    @Test
    void shouldLeaveExistingDefinitionsUntouched() {
        when(cronDefinitionClient.find("NIGHTLY_EXPORT"))
                .thenReturn(Optional.of(new CronDefinition("NIGHTLY_EXPORT", "0 0 3 * * *", "NIGHTLY_EXPORT")));

        initializer(new NightlyExportWorker()).start();

        verify(cronDefinitionClient, never()).define(anyString(), anyString(), anyString(), isNull(), any(), any());
    }

    @Test
    void shouldFailFastOnInvalidSchedule() {
        when(cronDefinitionClient.find("BROKEN_SCHEDULE")).thenReturn(Optional.empty());
        when(cronDefinitionClient.define(eq("BROKEN_SCHEDULE"), eq("not-a-cron"), eq("BROKEN_SCHEDULE"), isNull(),
                any(), any())).thenThrow(new InvalidCronScheduleException("not-a-cron", null));

        CronDefinitionInitializer initializer = initializer(new BrokenScheduleWorker());

        IllegalStateException ex = assertThrows(IllegalStateException.class, initializer::start);
        assertTrue(ex.getMessage().contains("BROKEN_SCHEDULE"));
    }

    @Test
    void shouldNotFailStartupWhenStoreIsUnavailable() {
        when(cronDefinitionClient.find("NIGHTLY_EXPORT")).thenThrow(new RuntimeException("connection refused"));

        assertDoesNotThrow(() -> initializer(new NightlyExportWorker()).start());
    }

    private CronDefinitionInitializer initializer(JobWorker<?>... workers) {
        JobTypeMetadataRegistry registry = new JobTypeMetadataRegistry(List.of(workers), new JobRelayProperties());
        registry.init();
        return new CronDefinitionInitializer(registry, cronDefinitionClient);
    }
}
