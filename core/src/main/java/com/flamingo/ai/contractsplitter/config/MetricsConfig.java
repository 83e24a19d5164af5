package com.flamingo.ai.contractsplitter.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for chunking metrics. */
@Configuration
public class MetricsConfig {

  /** Enables @Timed on the pipeline and the LLM classifier. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
