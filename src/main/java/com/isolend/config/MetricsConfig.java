package com.isolend.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter: the application name and the pool contract address, which tells
 * two deployments apart on a shared dashboard. Protocol counters live in
 * {@link com.isolend.observability.ProtocolMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> protocolCommonTags(
            @Value("${spring.application.name:isolend}") String applicationName,
            ProtocolParameters protocolParameters) {
        return registry -> registry.config()
                .commonTags("application", applicationName, "deployment", protocolParameters.getPoolAddress());
    }
}
