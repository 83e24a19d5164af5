package com.flamingo.ai.contractsplitter.service.classification;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Ordered, precompiled heading patterns.
 *
 * <p>The legal table lists one group of patterns per {@link HeadingLevel}, broadest unit first; the
 * generic table holds numbering styles that are common outside Chinese statutes ("Chapter 3",
 * "1.2 Scope", "Part II"). Every pattern is a prefix test anchored at the start of the text and
 * Latin letters match case-insensitively.
 *
 * <p>Instances are immutable and may be shared across threads.
 */
public final class HeadingPatternTable {

  private static final String CN_NUM = "[一二三四五六七八九十百千万零〇\\d]+";
  private static final String ROMAN = "(?-i:[IVXLC]+)";
  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  /** A compiled pattern bound to the level it signals. */
  public record Rule(Pattern pattern, HeadingLevel level) {}

  /**
   * A successful prefix match.
   *
   * @param level matched level
   * @param end index in the text just after the matched prefix
   */
  public record Match(HeadingLevel level, int end) {}

  /**
   * A legal marker found inside a text block, with the text it governs.
   *
   * @param level level signalled by the marker
   * @param start index of the marker in the scanned text
   * @param marker the marker itself, e.g. {@code 第二条}
   * @param text stripped text from the marker up to the next marker or the end of the block
   */
  public record InlineSection(HeadingLevel level, int start, String marker, String text) {}

  // Characters after which a structural marker may start a new unit
  private static final String UNIT_BOUNDARIES = "。；！？;!?";
  // A marker followed by one of these is a cross-reference such as 第三条规定
  private static final String REFERENCE_FOLLOWERS = "的规所中至和或及";

  private final List<Rule> legalRules;
  private final List<Rule> genericRules;
  private final List<Rule> inlineRules;

  private HeadingPatternTable(List<Rule> legalRules, List<Rule> genericRules) {
    this.legalRules = List.copyOf(legalRules);
    this.genericRules = List.copyOf(genericRules);
    this.inlineRules =
        legalRules.stream()
            .filter(rule -> rule.level().getValue() <= HeadingLevel.SUBITEM.getValue())
            .toList();
  }

  /** The built-in tables. */
  public static HeadingPatternTable defaults() {
    return new HeadingPatternTable(defaultLegalRules(), defaultGenericRules());
  }

  /**
   * The built-in tables extended with caller-supplied patterns.
   *
   * @param customPatterns patterns keyed by heading level name; appended after the built-in ones
   * @throws ChunkingConfigurationException for an unknown level name or an invalid regex
   */
  public static HeadingPatternTable withCustomPatterns(Map<String, List<String>> customPatterns) {
    if (customPatterns == null || customPatterns.isEmpty()) {
      return defaults();
    }
    List<Rule> legal = new ArrayList<>(defaultLegalRules());
    for (Map.Entry<String, List<String>> entry : customPatterns.entrySet()) {
      HeadingLevel level =
          HeadingLevel.fromName(entry.getKey())
              .orElseThrow(
                  () ->
                      ChunkingConfigurationException.unknownValue(
                          "custom pattern category",
                          entry.getKey(),
                          Arrays.stream(HeadingLevel.values())
                              .map(l -> l.name().toLowerCase(Locale.ROOT))
                              .toList()));
      for (String regex : entry.getValue()) {
        legal.add(new Rule(compile(regex), level));
      }
    }
    // Stable sort keeps built-in patterns ahead of custom ones within a level
    legal.sort(Comparator.comparingInt(rule -> rule.level().getValue()));
    return new HeadingPatternTable(legal, defaultGenericRules());
  }

  public Optional<Match> matchLegal(String text) {
    return firstMatch(legalRules, text);
  }

  public Optional<Match> matchGeneric(String text) {
    return firstMatch(genericRules, text);
  }

  /**
   * Finds every structural marker (编, 篇, 章, 节, 条, 款, 项, 目) that opens a unit inside {@code
   * text} and cuts the text at those markers. A marker counts when it starts the text or follows
   * whitespace or a sentence terminator; markers used as cross-references are skipped.
   *
   * <p>Text before the first marker is not part of any returned section.
   */
  public List<InlineSection> extractSections(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<Integer> starts = new ArrayList<>();
    List<Match> matches = new ArrayList<>();
    for (int i = 0; i < text.length(); i++) {
      if (!opensUnit(text, i)) {
        continue;
      }
      Optional<Match> match = firstMatchAt(inlineRules, text, i);
      if (match.isEmpty() || isReference(text, match.get().end())) {
        continue;
      }
      starts.add(i);
      matches.add(match.get());
      i = match.get().end() - 1;
    }

    List<InlineSection> sections = new ArrayList<>(starts.size());
    for (int k = 0; k < starts.size(); k++) {
      int start = starts.get(k);
      int end = k + 1 < starts.size() ? starts.get(k + 1) : text.length();
      Match match = matches.get(k);
      sections.add(
          new InlineSection(
              match.level(),
              start,
              text.substring(start, match.end()).strip(),
              text.substring(start, end).strip()));
    }
    return sections;
  }

  public List<Rule> getLegalRules() {
    return legalRules;
  }

  public List<Rule> getGenericRules() {
    return genericRules;
  }

  private static boolean opensUnit(String text, int index) {
    if (index == 0) {
      return true;
    }
    char previous = text.charAt(index - 1);
    return Character.isWhitespace(previous) || UNIT_BOUNDARIES.indexOf(previous) >= 0;
  }

  private static boolean isReference(String text, int markerEnd) {
    return markerEnd < text.length()
        && markerEnd > 0
        && !Character.isWhitespace(text.charAt(markerEnd - 1))
        && REFERENCE_FOLLOWERS.indexOf(text.charAt(markerEnd)) >= 0;
  }

  private static Optional<Match> firstMatchAt(List<Rule> rules, String text, int start) {
    for (Rule rule : rules) {
      Matcher matcher = rule.pattern().matcher(text);
      matcher.region(start, text.length());
      if (matcher.lookingAt()) {
        return Optional.of(new Match(rule.level(), matcher.end()));
      }
    }
    return Optional.empty();
  }

  private static Optional<Match> firstMatch(List<Rule> rules, String text) {
    for (Rule rule : rules) {
      Matcher matcher = rule.pattern().matcher(text);
      if (matcher.lookingAt()) {
        return Optional.of(new Match(rule.level(), matcher.end()));
      }
    }
    return Optional.empty();
  }

  private static List<Rule> defaultLegalRules() {
    List<Rule> rules = new ArrayList<>();
    rules.add(rule("第" + CN_NUM + "编\\s*", HeadingLevel.BOOK));
    rules.add(rule("第" + CN_NUM + "篇\\s*", HeadingLevel.PART));
    rules.add(rule("第" + CN_NUM + "章\\s*", HeadingLevel.CHAPTER));
    rules.add(rule("第" + CN_NUM + "节\\s*", HeadingLevel.SECTION));
    rules.add(rule("第" + CN_NUM + "条\\s*", HeadingLevel.ARTICLE));
    rules.add(rule("第" + CN_NUM + "款\\s*", HeadingLevel.CLAUSE));
    rules.add(rule("第" + CN_NUM + "项\\s*", HeadingLevel.ITEM));
    rules.add(rule("第" + CN_NUM + "目\\s*", HeadingLevel.SUBITEM));
    rules.add(rule("（" + CN_NUM + "）\\s*", HeadingLevel.ENUMERATION));
    rules.add(rule("\\(" + CN_NUM + "\\)\\s*", HeadingLevel.ENUMERATION));
    rules.add(rule("[一二三四五六七八九十百千万]+[、．.]\\s*", HeadingLevel.ENUMERATION));
    rules.add(rule("\\d+[、．.]\\s*", HeadingLevel.NUMBERING));
    rules.add(rule("\\d+\\.\\d+[、．.]?\\s*", HeadingLevel.NUMBERING));
    rules.add(rule("\\d+\\)\\s*", HeadingLevel.NUMBERING));
    return rules;
  }

  private static List<Rule> defaultGenericRules() {
    List<Rule> rules = new ArrayList<>();
    rules.add(rule("第" + CN_NUM + "部分\\s*", HeadingLevel.PART));
    rules.add(rule("Part\\s+(\\d+|" + ROMAN + ")\\b", HeadingLevel.PART));
    rules.add(rule("Chapter\\s+(\\d+|" + ROMAN + ")\\b", HeadingLevel.CHAPTER));
    rules.add(rule("Section\\s+\\d+(\\.\\d+)*\\b", HeadingLevel.SECTION));
    rules.add(rule("§\\s*\\d+", HeadingLevel.SECTION));
    rules.add(rule("Article\\s+(\\d+|" + ROMAN + ")\\b", HeadingLevel.ARTICLE));
    rules.add(rule("[①②③④⑤⑥⑦⑧⑨⑩⑪⑫⑬⑭⑮⑯⑰⑱⑲⑳]\\s*", HeadingLevel.ENUMERATION));
    rules.add(rule(ROMAN + "\\.\\s+", HeadingLevel.ENUMERATION));
    rules.add(rule("\\d+\\.\\d+(\\.\\d+)*\\.?\\s+", HeadingLevel.NUMBERING));
    rules.add(rule("\\d+\\.?\\s+", HeadingLevel.NUMBERING));
    return rules;
  }

  private static Rule rule(String regex, HeadingLevel level) {
    return new Rule(compile(regex), level);
  }

  private static Pattern compile(String regex) {
    try {
      return Pattern.compile(regex.startsWith("^") ? regex.substring(1) : regex, FLAGS);
    } catch (PatternSyntaxException e) {
      throw new ChunkingConfigurationException(
          "heading pattern", regex, "Invalid heading pattern '" + regex + "': " + e.getMessage());
    }
  }
}
