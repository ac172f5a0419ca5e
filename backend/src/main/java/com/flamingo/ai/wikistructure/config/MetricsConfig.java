package com.flamingo.ai.wikistructure.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring; document counters are registered by the services that own them. */
@Configuration
public class MetricsConfig {

  /** Backs {@code @Timed} on {@code EntityStructuringService#structure}. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
