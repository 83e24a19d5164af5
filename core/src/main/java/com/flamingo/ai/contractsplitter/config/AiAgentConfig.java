package com.flamingo.ai.contractsplitter.config;

import com.flamingo.ai.contractsplitter.agent.HeadingClassificationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare their prompts with @SystemMessage/@UserMessage; implementations are
 * generated by AiServices.builder().
 */
@Configuration
@ConditionalOnProperty(prefix = "splitter.llm", name = "enabled", havingValue = "true")
public class AiAgentConfig {

  /** Heading classification agent. Uses the JSON-mode ChatModel for structured verdicts. */
  @Bean
  public HeadingClassificationAgent headingClassificationAgent(ChatModel chatModel) {
    return AiServices.builder(HeadingClassificationAgent.class).chatModel(chatModel).build();
  }
}
