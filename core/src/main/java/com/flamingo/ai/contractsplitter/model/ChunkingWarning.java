package com.flamingo.ai.contractsplitter.model;

/**
 * A best-effort degradation recorded while chunking a document.
 *
 * <p>Warnings never abort processing; they are returned next to the chunks so callers can decide
 * whether an oversized chunk or a fallback classification matters to them.
 *
 * @param type what kind of degradation happened
 * @param message human-readable description
 * @param excerpt the first characters of the affected text
 */
public record ChunkingWarning(Type type, String message, String excerpt) {

  private static final int EXCERPT_LENGTH = 40;

  public enum Type {
    /** A single sentence was longer than the maximum size and was emitted as-is. */
    OVERSIZED_SENTENCE,
    /** No sentence boundary fitted the overlap window, so a raw tail was used. */
    RAW_OVERLAP,
    /** The remote heading classifier failed and the rule-based one was used instead. */
    CLASSIFIER_FALLBACK
  }

  public static ChunkingWarning of(Type type, String message, String text) {
    return new ChunkingWarning(type, message, excerpt(text));
  }

  private static String excerpt(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH) + "...";
  }
}
