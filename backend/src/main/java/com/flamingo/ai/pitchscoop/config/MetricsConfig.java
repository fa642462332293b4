package com.flamingo.ai.pitchscoop.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for pipeline metrics. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on pipeline and gateway methods. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every pipeline meter with the application name so shared dashboards can filter. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> pipelineCommonTags(
      @Value("${spring.application.name:pitchscoop}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
