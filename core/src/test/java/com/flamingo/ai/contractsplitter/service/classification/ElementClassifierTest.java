package com.flamingo.ai.contractsplitter.service.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contractsplitter.model.Element;
import com.flamingo.ai.contractsplitter.model.ElementKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElementClassifier Tests")
class ElementClassifierTest {

  @Mock private HeadingClassifier classifier;

  @Test
  @DisplayName("should classify only unclassified paragraphs in a single batch")
  void shouldClassifyOnlyUnclassifiedParagraphs() {
    List<Element> elements =
        List.of(
            Element.heading("Master Services Agreement", 1),
            Element.paragraph(" 第一条 定义 "),
            Element.content("Already known body text."),
            Element.paragraph("The parties agree as follows."));
    when(classifier.classifyAll(List.of("第一条 定义", "The parties agree as follows.")))
        .thenReturn(
            List.of(
                ClassificationResult.heading(HeadingLevel.ARTICLE),
                ClassificationResult.notHeading()));

    List<Element> classified = ElementClassifier.classify(elements, classifier);

    assertThat(classified).hasSize(4);
    assertThat(classified.get(0)).isEqualTo(elements.get(0));
    assertThat(classified.get(1).heading()).isTrue();
    assertThat(classified.get(1).level()).isEqualTo(5);
    assertThat(classified.get(1).kind()).isEqualTo(ElementKind.HEADING);
    assertThat(classified.get(2)).isEqualTo(elements.get(2));
    assertThat(classified.get(3).heading()).isFalse();
    assertThat(classified.get(3).level()).isEqualTo(HeadingLevel.DEFAULT_LEVEL);
  }

  @Test
  @DisplayName("should never promote table cells to headings")
  void shouldNeverPromoteTableCells() {
    Element cell =
        new Element("第一章 总则", false, Element.UNSET_LEVEL, ElementKind.TABLE_CELL, "r1c1");

    List<Element> classified = ElementClassifier.classify(List.of(cell), classifier);

    assertThat(classified.get(0).heading()).isFalse();
    assertThat(classified.get(0).level()).isEqualTo(HeadingLevel.DEFAULT_LEVEL);
    assertThat(classified.get(0).kind()).isEqualTo(ElementKind.TABLE_CELL);
    verify(classifier, never()).classifyAll(anyList());
  }

  @Test
  @DisplayName("should skip the classifier when nothing needs classification")
  void shouldSkipClassifierWhenAllClassified() {
    List<Element> elements = List.of(Element.heading("Recitals", 2), Element.paragraph("   "));

    List<Element> classified = ElementClassifier.classify(elements, classifier);

    assertThat(classified).isEqualTo(elements);
    verify(classifier, never()).classifyAll(anyList());
  }

  @Test
  @DisplayName("should cut a paragraph holding several articles into headings and content")
  void shouldSplitInlineArticles() {
    List<Element> elements =
        List.of(Element.paragraph("第一章 总则 第一条 为了规范合同，制定本法。第二条 依照第一条的规定执行。"));

    List<Element> classified = ElementClassifier.classify(elements, classifier);

    assertThat(classified)
        .containsExactly(
            Element.heading("第一章 总则", 3),
            Element.heading("第一条", 5),
            Element.content("为了规范合同，制定本法。"),
            Element.heading("第二条", 5),
            Element.content("依照第一条的规定执行。"));
    verify(classifier, never()).classifyAll(anyList());
  }

  @Test
  @DisplayName("should keep the preamble of a cut paragraph for the classifier")
  void shouldClassifyPreambleOfSplitParagraph() {
    List<Element> elements = List.of(Element.paragraph("总则如下：\n第一条 定义\n本合同术语含义如下。"));
    when(classifier.classifyAll(List.of("总则如下：")))
        .thenReturn(List.of(ClassificationResult.notHeading()));

    List<Element> classified = ElementClassifier.classify(elements, classifier);

    assertThat(classified)
        .containsExactly(
            new Element("总则如下：", false, HeadingLevel.DEFAULT_LEVEL, ElementKind.PARAGRAPH, null),
            Element.heading("第一条 定义", 5),
            Element.content("本合同术语含义如下。"));
  }

  @Test
  @DisplayName("should leave paragraphs with explicit levels uncut")
  void shouldNotSplitClassifiedParagraphs() {
    Element known = Element.content("第一条 甲方付款。第二条 乙方交付。");

    List<Element> classified = ElementClassifier.classify(List.of(known), classifier);

    assertThat(classified).containsExactly(known);
  }
}
