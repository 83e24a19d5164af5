package com.flamingo.ai.contractsplitter.service.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HeadingPatternTable Tests")
class HeadingPatternTableTest {

  @Test
  @DisplayName("legal rules should be ordered from broadest to narrowest level")
  void legalRulesShouldBeOrderedByLevel() {
    List<HeadingPatternTable.Rule> rules = HeadingPatternTable.defaults().getLegalRules();

    assertThat(rules)
        .extracting(rule -> rule.level().getValue())
        .isSortedAccordingTo(Integer::compare);
  }

  @Test
  @DisplayName("should report the end of the matched marker")
  void shouldReportMatchEnd() {
    HeadingPatternTable.Match match =
        HeadingPatternTable.defaults().matchLegal("第十二条 保密义务").orElseThrow();

    assertThat(match.level()).isEqualTo(HeadingLevel.ARTICLE);
    assertThat("第十二条 保密义务".substring(match.end())).isEqualTo("保密义务");
  }

  @Test
  @DisplayName("should only match markers at the start of the text")
  void shouldOnlyMatchAtStart() {
    assertThat(HeadingPatternTable.defaults().matchLegal("依照第三条规定执行")).isEmpty();
  }

  @Test
  @DisplayName("should not treat lower-case words as roman numerals")
  void shouldNotTreatLowerCaseWordsAsRomanNumerals() {
    assertThat(HeadingPatternTable.defaults().matchGeneric("civil. remedies")).isEmpty();
    assertThat(HeadingPatternTable.defaults().matchGeneric("Part x of the plan")).isEmpty();
  }

  @Test
  @DisplayName("should keep custom patterns after built-in ones of the same level")
  void shouldAppendCustomPatternsWithinLevel() {
    HeadingPatternTable table =
        HeadingPatternTable.withCustomPatterns(Map.of("chapter", List.of("Schedule\\s+\\d+")));

    List<HeadingPatternTable.Rule> chapterRules =
        table.getLegalRules().stream().filter(r -> r.level() == HeadingLevel.CHAPTER).toList();
    assertThat(chapterRules).hasSize(2);
    assertThat(chapterRules.get(1).pattern().pattern()).isEqualTo("Schedule\\s+\\d+");
    assertThat(table.matchLegal("schedule 2 Pricing").orElseThrow().level())
        .isEqualTo(HeadingLevel.CHAPTER);
  }

  @Test
  @DisplayName("should reject invalid custom regex")
  void shouldRejectInvalidRegex() {
    assertThatThrownBy(
            () -> HeadingPatternTable.withCustomPatterns(Map.of("item", List.of("(unclosed"))))
        .isInstanceOf(ChunkingConfigurationException.class)
        .hasMessageContaining("(unclosed");
  }

  @Test
  @DisplayName("custom patterns should leave the generic table untouched")
  void customPatternsShouldNotChangeGenericRules() {
    HeadingPatternTable defaults = HeadingPatternTable.defaults();
    HeadingPatternTable custom =
        HeadingPatternTable.withCustomPatterns(Map.of("article", List.of("Clause\\s+\\d+")));

    assertThat(custom.getGenericRules()).hasSameSizeAs(defaults.getGenericRules());
    assertThat(custom.getGenericRules())
        .extracting(rule -> rule.pattern().pattern())
        .doesNotContain("Clause\\s+\\d+");
  }

  @Test
  @DisplayName("should cut a block at every inline structural marker")
  void shouldExtractInlineSections() {
    String text = "第一章 总则 第一条 为了规范合同，制定本法。第二条 依照第一条的规定执行。";

    List<HeadingPatternTable.InlineSection> sections =
        HeadingPatternTable.defaults().extractSections(text);

    assertThat(sections)
        .extracting(HeadingPatternTable.InlineSection::level)
        .containsExactly(HeadingLevel.CHAPTER, HeadingLevel.ARTICLE, HeadingLevel.ARTICLE);
    assertThat(sections)
        .extracting(HeadingPatternTable.InlineSection::marker)
        .containsExactly("第一章", "第一条", "第二条");
    assertThat(sections)
        .extracting(HeadingPatternTable.InlineSection::text)
        .containsExactly("第一章 总则", "第一条 为了规范合同，制定本法。", "第二条 依照第一条的规定执行。");
    assertThat(sections.get(1).start()).isEqualTo(7);
  }

  @Test
  @DisplayName("should skip cross-references and markers inside a sentence")
  void shouldSkipCrossReferences() {
    HeadingPatternTable table = HeadingPatternTable.defaults();

    assertThat(table.extractSections("合同成立。第三条规定的期限不适用。")).isEmpty();
    assertThat(table.extractSections("依照本法第三条执行")).isEmpty();
    assertThat(table.extractSections("")).isEmpty();
  }

  @Test
  @DisplayName("should not cut at enumeration or numbering markers")
  void shouldIgnoreEnumerationInline() {
    List<HeadingPatternTable.InlineSection> sections =
        HeadingPatternTable.defaults().extractSections("第五条 义务如下。（一）按时付款。1. 及时交付。");

    assertThat(sections).hasSize(1);
    assertThat(sections.get(0).text()).isEqualTo("第五条 义务如下。（一）按时付款。1. 及时交付。");
  }
}
