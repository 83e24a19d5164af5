package com.flamingo.ai.contractsplitter.service.chunking;

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;

/** {@link SizeFunction} counting tokens with the tokenizer of an OpenAI model. */
public class TokenCountSizeFunction implements SizeFunction {

  private final OpenAiTokenCountEstimator estimator;

  public TokenCountSizeFunction(String modelName) {
    this.estimator = new OpenAiTokenCountEstimator(modelName);
  }

  @Override
  public int measure(String text) {
    if (text.isEmpty()) {
      return 0;
    }
    return estimator.estimateTokenCountInText(text);
  }
}
