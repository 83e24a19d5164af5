package com.flamingo.ai.contractsplitter.config;

import com.flamingo.ai.contractsplitter.agent.HeadingClassificationAgent;
import com.flamingo.ai.contractsplitter.service.classification.HeadingClassifier;
import com.flamingo.ai.contractsplitter.service.classification.LlmHeadingClassifier;
import com.flamingo.ai.contractsplitter.service.classification.PatternHeadingClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the heading classifiers.
 *
 * <p>The rule-based classifier is always present. When {@code splitter.llm.enabled=true} the LLM
 * classifier becomes the primary bean and uses the rule-based one as its fallback.
 */
@Configuration
public class ClassifierConfig {

  @Bean
  public DocumentProfile documentProfile(SplitterConfig splitterConfig) {
    return DocumentProfile.fromValue(splitterConfig.getDocumentType());
  }

  @Bean(name = "ruleBasedHeadingClassifier")
  public HeadingClassifier ruleBasedHeadingClassifier(
      DocumentProfile documentProfile, SplitterConfig splitterConfig) {
    return PatternHeadingClassifier.fromConfig(
        documentProfile, splitterConfig.getClassification());
  }

  @Bean(name = "headingClassificationExecutor", destroyMethod = "shutdown")
  @ConditionalOnProperty(prefix = "splitter.llm", name = "enabled", havingValue = "true")
  public ThreadPoolTaskExecutor headingClassificationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("heading-llm-");
    executor.initialize();
    return executor;
  }

  @Bean
  @Primary
  @ConditionalOnProperty(prefix = "splitter.llm", name = "enabled", havingValue = "true")
  public HeadingClassifier llmHeadingClassifier(
      HeadingClassificationAgent agent,
      @Qualifier("ruleBasedHeadingClassifier") HeadingClassifier ruleBasedHeadingClassifier,
      MeterRegistry meterRegistry,
      @Qualifier("headingClassificationExecutor") ThreadPoolTaskExecutor executor,
      SplitterConfig splitterConfig) {
    return new LlmHeadingClassifier(
        agent, ruleBasedHeadingClassifier, meterRegistry, executor, splitterConfig.getLlm());
  }
}
