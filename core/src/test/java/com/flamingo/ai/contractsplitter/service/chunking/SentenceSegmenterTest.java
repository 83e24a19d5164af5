package com.flamingo.ai.contractsplitter.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SentenceSegmenter Tests")
class SentenceSegmenterTest {

  private static List<String> sentences(String text) {
    return SentenceSegmenter.segment(text).stream()
        .map(span -> text.substring(span.start(), span.end()))
        .toList();
  }

  @Test
  @DisplayName("should split on full-width terminators and keep them")
  void shouldSplitOnFullWidthTerminators() {
    assertThat(sentences("第一条 ABC。第二条 DEF！是否？是；"))
        .containsExactly("第一条 ABC。", "第二条 DEF！", "是否？", "是；");
  }

  @Test
  @DisplayName("should absorb closing quotes and repeated terminators")
  void shouldAbsorbClosingQuotes() {
    assertThat(sentences("He said \"Stop!\" Then he left?! 他说：“好。”然后离开。"))
        .containsExactly("He said \"Stop!\"", "Then he left?!", "他说：“好。”", "然后离开。");
  }

  @Test
  @DisplayName("should not split on decimal points")
  void shouldNotSplitOnDecimalPoints() {
    assertThat(sentences("The fee is 3.5 percent. Payable monthly."))
        .containsExactly("The fee is 3.5 percent.", "Payable monthly.");
  }

  @Test
  @DisplayName("should keep trailing text without terminator as last sentence")
  void shouldKeepTrailingFragment() {
    assertThat(sentences("  First one.   trailing words  "))
        .containsExactly("First one.", "trailing words");
  }

  @Test
  @DisplayName("should return no spans for blank text")
  void shouldReturnNothingForBlankText() {
    assertThat(SentenceSegmenter.segment("")).isEmpty();
    assertThat(SentenceSegmenter.segment("   ")).isEmpty();
  }
}
