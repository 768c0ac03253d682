package com.jobrelay;

import com.jobrelay.internal.JobRelayMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link JobRelayMetrics} once a {@link MeterRegistry} exists, including one contributed by Actuator.
 */
@AutoConfiguration(after = JobRelayAutoConfiguration.class, afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration" })
@ConditionalOnClass(MeterRegistry.class)
public class JobRelayMetricsAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public JobRelayMetrics jobRelayMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        return new JobRelayMetrics(jobRepository, meterRegistry);
    }
}
