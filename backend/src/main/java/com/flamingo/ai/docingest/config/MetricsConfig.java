package com.flamingo.ai.docingest.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Timers for the ingestion entry points ({@code ingest.chunk}, {@code ingest.extract_code}, {@code
 * ingest.prepare}, {@code ingest.code_title}).
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every ingestion meter with the application name so runs can be told apart. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> ingestCommonTags(
      @Value("${spring.application.name:doc-ingest}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
