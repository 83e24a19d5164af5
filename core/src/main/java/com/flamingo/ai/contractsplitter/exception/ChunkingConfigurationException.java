package com.flamingo.ai.contractsplitter.exception;

import java.util.Collection;

/**
 * Exception thrown when chunking is requested with an invalid configuration value.
 *
 * <p>This is the only failure the pipeline surfaces to its callers; irregular document content is
 * always absorbed with best-effort behaviour.
 */
public class ChunkingConfigurationException extends RuntimeException {

  private final String option;
  private final String invalidValue;

  public ChunkingConfigurationException(String option, Object invalidValue, String message) {
    super(message);
    this.option = option;
    this.invalidValue = String.valueOf(invalidValue);
  }

  /** Builds the exception for a value outside a closed set of recognised options. */
  public static ChunkingConfigurationException unknownValue(
      String option, Object invalidValue, Collection<String> validValues) {
    return new ChunkingConfigurationException(
        option,
        invalidValue,
        "Invalid " + option + " '" + invalidValue + "'. Valid values: " + validValues);
  }

  public String getOption() {
    return option;
  }

  public String getInvalidValue() {
    return invalidValue;
  }
}
