package com.flamingo.ai.contractsplitter.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j chat model used by LLM heading classification. */
@Configuration
@ConditionalOnProperty(prefix = "splitter.llm", name = "enabled", havingValue = "true")
public class LangChain4jConfig {

  @Bean
  public ChatModel chatModel(SplitterConfig splitterConfig) {
    SplitterConfig.Llm llm = splitterConfig.getLlm();
    validateApiKey(llm.getApiKey());

    return OpenAiChatModel.builder()
        .apiKey(llm.getApiKey())
        .baseUrl(llm.getBaseUrl())
        .modelName(llm.getModelName())
        .temperature(llm.getTemperature())
        .maxCompletionTokens(llm.getMaxCompletionTokens())
        .timeout(Duration.ofMillis(llm.getTimeoutMs()))
        .maxRetries(0)
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey(String apiKey) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required when splitter.llm.enabled=true. Set OPENAI_API_KEY.");
    }
  }
}
