package com.flamingo.ai.contractsplitter.service.classification;

import com.flamingo.ai.contractsplitter.config.DocumentProfile;
import com.flamingo.ai.contractsplitter.config.SplitterConfig;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rule-based {@link HeadingClassifier} driven by a {@link HeadingPatternTable}.
 *
 * <p>Classification order:
 *
 * <ol>
 *   <li>the legal table, broadest unit first; the first matching pattern decides the level;
 *   <li>the generic numbering table, when the profile allows it;
 *   <li>a short-line heuristic: short text without sentence terminator, clause punctuation or
 *       content keywords is taken as a heading at {@link HeadingLevel#DEFAULT_LEVEL}.
 * </ol>
 *
 * <p>An article match ("第五条 …") is downgraded to plain content when the fragment is long or its
 * body carries content markers, since statute bodies routinely start with the article number.
 *
 * <p>Holds only immutable state; a single instance can be shared by any number of threads.
 */
public class PatternHeadingClassifier implements HeadingClassifier {

  public static final int DEFAULT_FUZZY_MAX_LENGTH = 30;
  public static final int DEFAULT_ARTICLE_MAX_LENGTH = 50;

  private static final int MIN_HEADING_LENGTH = 2;
  private static final int MAX_HEADING_LENGTH = 200;

  private static final String SENTENCE_TERMINATORS = "。.！!？?；;：:";
  private static final String CLAUSE_PUNCTUATION = "，,、";
  private static final List<String> CONTENT_KEYWORDS = List.of("内容", "规定", "说明", "包含", "详细");
  private static final List<String> ARTICLE_BODY_MARKERS =
      List.of("内容", "规定", "说明", "包含", "详细", "很长", "content", "described", "detailed");

  private final HeadingPatternTable patternTable;
  private final boolean genericPatternsEnabled;
  private final boolean fuzzyMatchingEnabled;
  private final int fuzzyMaxLength;
  private final int articleMaxLength;

  public PatternHeadingClassifier(
      HeadingPatternTable patternTable,
      boolean genericPatternsEnabled,
      boolean fuzzyMatchingEnabled,
      int fuzzyMaxLength,
      int articleMaxLength) {
    this.patternTable = patternTable;
    this.genericPatternsEnabled = genericPatternsEnabled;
    this.fuzzyMatchingEnabled = fuzzyMatchingEnabled;
    this.fuzzyMaxLength = fuzzyMaxLength;
    this.articleMaxLength = articleMaxLength;
  }

  /** Classifier for general documents: all tables and the short-line heuristic. */
  public static PatternHeadingClassifier defaults() {
    return forProfile(DocumentProfile.GENERAL);
  }

  public static PatternHeadingClassifier forProfile(DocumentProfile profile) {
    return new PatternHeadingClassifier(
        HeadingPatternTable.defaults(),
        profile.isGenericPatternsEnabled(),
        profile.isFuzzyMatchingEnabled(),
        DEFAULT_FUZZY_MAX_LENGTH,
        DEFAULT_ARTICLE_MAX_LENGTH);
  }

  /** Builds the classifier from bound configuration, including custom patterns. */
  public static PatternHeadingClassifier fromConfig(
      DocumentProfile profile, SplitterConfig.Classification config) {
    return new PatternHeadingClassifier(
        HeadingPatternTable.withCustomPatterns(config.getCustomPatterns()),
        profile.isGenericPatternsEnabled(),
        profile.isFuzzyMatchingEnabled() && config.isFuzzyMatchingEnabled(),
        config.getFuzzyMaxLength(),
        config.getArticleMaxLength());
  }

  @Override
  public ClassificationResult classify(String text) {
    if (text == null) {
      return ClassificationResult.notHeading();
    }
    String trimmed = text.strip();
    int length = trimmed.codePointCount(0, trimmed.length());
    if (length < MIN_HEADING_LENGTH || length > MAX_HEADING_LENGTH) {
      return ClassificationResult.notHeading();
    }

    Optional<HeadingPatternTable.Match> legal = patternTable.matchLegal(trimmed);
    if (legal.isPresent()) {
      return fromMatch(trimmed, length, legal.get());
    }

    if (genericPatternsEnabled) {
      Optional<HeadingPatternTable.Match> generic = patternTable.matchGeneric(trimmed);
      if (generic.isPresent()) {
        return fromMatch(trimmed, length, generic.get());
      }
    }

    if (fuzzyMatchingEnabled && looksLikeShortHeading(trimmed, length)) {
      return ClassificationResult.heading(HeadingLevel.DEFAULT_LEVEL);
    }
    return ClassificationResult.notHeading();
  }

  private ClassificationResult fromMatch(
      String text, int length, HeadingPatternTable.Match match) {
    if (match.level() == HeadingLevel.ARTICLE && looksLikeArticleBody(text, length, match.end())) {
      return ClassificationResult.notHeading();
    }
    return ClassificationResult.heading(match.level());
  }

  private boolean looksLikeArticleBody(String text, int length, int markerEnd) {
    if (length > articleMaxLength) {
      return true;
    }
    String body = text.substring(markerEnd).toLowerCase(Locale.ROOT);
    return ARTICLE_BODY_MARKERS.stream().anyMatch(body::contains);
  }

  private boolean looksLikeShortHeading(String text, int length) {
    if (length >= fuzzyMaxLength) {
      return false;
    }
    int last = text.codePointBefore(text.length());
    if (SENTENCE_TERMINATORS.indexOf(last) >= 0) {
      return false;
    }
    if (text.codePoints().anyMatch(cp -> CLAUSE_PUNCTUATION.indexOf(cp) >= 0)) {
      return false;
    }
    return CONTENT_KEYWORDS.stream().noneMatch(text::contains);
  }
}
