package com.flamingo.ai.interviewinsights.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for analysis metrics and the reference clock. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on the analysis entry points.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(
      @Value("${spring.application.name:interview-insights}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }

  /** Clock the run reference date is taken from. */
  @Bean
  public Clock analysisClock() {
    return Clock.systemUTC();
  }
}
