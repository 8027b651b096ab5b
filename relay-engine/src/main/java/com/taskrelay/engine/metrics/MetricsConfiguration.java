package com.taskrelay.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the relay.
 *
 * Configures:
 * - Common tags for all metrics
 * - The relay meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "task-relay");
    }

    @Bean
    public RelayMetrics relayMetrics() {
        return new RelayMetrics();
    }
}
