package com.foliogate.config;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.statsd.StatsdConfig;
import io.micrometer.statsd.StatsdFlavor;
import io.micrometer.statsd.StatsdMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Ships gateway, rate limit and ledger meters to the local DogStatsD agent.
 * Every meter registered through the primary registry carries the service and env tags,
 * so meter definitions only add their own dimensions.
 */
@Configuration
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsConfig.class);

    private final String agentHost;
    private final int statsdPort;
    private final String serviceName;
    private final String environment;

    public DatadogMetricsConfig(
            @Value("${DD_AGENT_HOST:localhost}") String agentHost,
            @Value("${DD_DOGSTATSD_PORT:8125}") int statsdPort,
            @Value("${spring.application.name:folio-gate}") String serviceName,
            @Value("${DD_ENV:local}") String environment) {
        this.agentHost = agentHost;
        this.statsdPort = statsdPort;
        this.serviceName = serviceName;
        this.environment = environment;
    }

    @Bean
    public StatsdConfig statsdConfig() {
        return new StatsdConfig() {
            @Override
            public String get(String key) {
                return null;
            }

            @Override
            public StatsdFlavor flavor() {
                return StatsdFlavor.DATADOG;
            }

            @Override
            public String host() {
                return agentHost;
            }

            @Override
            public int port() {
                return statsdPort;
            }
        };
    }

    @Bean
    public StatsdMeterRegistry statsdMeterRegistry(StatsdConfig statsdConfig) {
        logger.info("DogStatsD registry for {} ({}) -> {}:{}", serviceName, environment, agentHost, statsdPort);
        return new StatsdMeterRegistry(statsdConfig, Clock.SYSTEM);
    }

    @Bean
    @Primary
    public CompositeMeterRegistry compositeMeterRegistry(MeterRegistry defaultRegistry,
                                                         StatsdMeterRegistry statsdRegistry) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        composite.config().commonTags("service", serviceName, "env", environment);
        composite.add(defaultRegistry);
        composite.add(statsdRegistry);
        return composite;
    }
}
