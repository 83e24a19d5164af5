package com.flamingo.ai.contractsplitter.config;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Presets for the kinds of documents the splitter is tuned for.
 *
 * <p>{@link #LEGAL} documents (statutes, measures) rely on the legal pattern table alone: generic
 * numbering and the short-line heuristic are switched off because statute bodies are full of short
 * enumerated lines that are not headings.
 */
public enum DocumentProfile {
  LEGAL("legal", 1500, 100, true, false, false),
  CONTRACT("contract", 2000, 200, true, true, true),
  REGULATION("regulation", 1800, 150, true, true, true),
  GENERAL("general", 2000, 200, false, true, true);

  private final String value;
  private final int maxSize;
  private final int overlap;
  private final boolean strictSizing;
  private final boolean genericPatternsEnabled;
  private final boolean fuzzyMatchingEnabled;

  DocumentProfile(
      String value,
      int maxSize,
      int overlap,
      boolean strictSizing,
      boolean genericPatternsEnabled,
      boolean fuzzyMatchingEnabled) {
    this.value = value;
    this.maxSize = maxSize;
    this.overlap = overlap;
    this.strictSizing = strictSizing;
    this.genericPatternsEnabled = genericPatternsEnabled;
    this.fuzzyMatchingEnabled = fuzzyMatchingEnabled;
  }

  public static DocumentProfile fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (DocumentProfile profile : values()) {
        if (profile.value.equals(normalized)) {
          return profile;
        }
      }
    }
    throw ChunkingConfigurationException.unknownValue("document type", value, validValues());
  }

  public static List<String> validValues() {
    return Arrays.stream(values()).map(DocumentProfile::getValue).toList();
  }

  public String getValue() {
    return value;
  }

  public int getMaxSize() {
    return maxSize;
  }

  public int getOverlap() {
    return overlap;
  }

  public boolean isStrictSizing() {
    return strictSizing;
  }

  public boolean isGenericPatternsEnabled() {
    return genericPatternsEnabled;
  }

  public boolean isFuzzyMatchingEnabled() {
    return fuzzyMatchingEnabled;
  }
}
