package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/** How a section tree is turned into chunks. */
public enum ChunkingStrategy {

  /** Only sections without sub-sections produce chunks. */
  FINEST_GRANULARITY("finest_granularity"),

  /** Every section with content produces a chunk, at every depth. */
  ALL_LEVELS("all_levels"),

  /** Same output as {@link #FINEST_GRANULARITY}; kept for configurations that still name it. */
  PARENT_ONLY("parent_only");

  private final String value;

  ChunkingStrategy(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static ChunkingStrategy fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (ChunkingStrategy strategy : values()) {
        if (strategy.value.equals(normalized)) {
          return strategy;
        }
      }
    }
    throw ChunkingConfigurationException.unknownValue("chunking strategy", value, validValues());
  }

  public static List<String> validValues() {
    return Arrays.stream(values()).map(ChunkingStrategy::getValue).toList();
  }
}
