package com.pumpfun.indexer.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default tracing setup for the indexer when {@code otel.enabled} is unset or false.
 *
 * <p>{@code IndexingLoop} and {@code DailyWinnerService} always open spans; with this config
 * they go to {@link OpenTelemetry#noop()} and nothing is exported. {@link OTelConfig} takes
 * over when an OTLP collector is configured.
 */
@Configuration
@ConditionalOnProperty(name = "otel.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpTracerConfig {

    @Bean
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("pumpfun-indexer-noop");
    }
}
