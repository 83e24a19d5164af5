package com.flamingo.ai.contractsplitter.exception;

/** Exception thrown when the LLM heading classification service answers unusably. */
public class LlmServiceException extends RuntimeException {

  public LlmServiceException(String message) {
    super(message);
  }
}
