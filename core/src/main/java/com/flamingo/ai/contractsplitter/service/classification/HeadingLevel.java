package com.flamingo.ai.contractsplitter.service.classification;

import java.util.Locale;
import java.util.Optional;

/**
 * Structural units of legal and contract documents, ordered from broadest to narrowest.
 *
 * <p>The numeric value is the hierarchy level used throughout the pipeline: 1 is the topmost unit
 * and larger numbers are deeper.
 */
public enum HeadingLevel {
  BOOK(1), // 编
  PART(2), // 篇
  CHAPTER(3), // 章
  SECTION(4), // 节
  ARTICLE(5), // 条
  CLAUSE(6), // 款
  ITEM(7), // 项
  SUBITEM(8), // 目
  PARAGRAPH(9), // 段
  ENUMERATION(10), // （一） 一、
  NUMBERING(11); // 1、 1.2

  /** Level assigned to plain content and to headings found only by the short-line heuristic. */
  public static final int DEFAULT_LEVEL = 10;

  public static final int MIN_LEVEL = BOOK.value;
  public static final int MAX_LEVEL = NUMBERING.value;

  private final int value;

  HeadingLevel(int value) {
    this.value = value;
  }

  public int getValue() {
    return value;
  }

  /** Looks up a level by its lower-case name, e.g. {@code "article"}. */
  public static Optional<HeadingLevel> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (HeadingLevel level : values()) {
      if (level.name().equals(normalized)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }

  /** Clamps an arbitrary level number into the supported range. */
  public static int clamp(int level) {
    return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
  }
}
