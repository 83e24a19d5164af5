package com.flamingo.ai.contractsplitter.service.classification;

import com.flamingo.ai.contractsplitter.model.Element;
import com.flamingo.ai.contractsplitter.model.ElementKind;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills in heading flags and levels for extracted elements the extractor left unclassified.
 *
 * <p>Elements with an explicit heading flag or level keep them. Table cells are never promoted to
 * headings; they become content at {@link HeadingLevel#DEFAULT_LEVEL}. An unclassified paragraph
 * that runs several legal units together (e.g. {@code 第一条 ... 第二条 ...} extracted from one PDF
 * block) is first cut at its markers into heading and content elements. All remaining paragraphs
 * are sent to the classifier in one call so remote classifiers can batch them.
 */
@Slf4j
public final class ElementClassifier {

  private static final HeadingPatternTable MARKERS = HeadingPatternTable.defaults();
  private static final String TERMINATORS = "。；！？;!?";

  private ElementClassifier() {}

  public static List<Element> classify(List<Element> input, HeadingClassifier classifier) {
    List<Element> elements = splitInlineSections(input);
    List<Integer> pending = new ArrayList<>();
    List<String> texts = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) {
      Element element = elements.get(i);
      if (element.isUnclassified() && !element.text().isBlank()) {
        pending.add(i);
        texts.add(element.text().strip());
      }
    }

    List<Element> classified = new ArrayList<>(elements.size());
    for (Element element : elements) {
      if (element.kind() == ElementKind.TABLE_CELL && element.level() == Element.UNSET_LEVEL) {
        classified.add(element.withClassification(false, HeadingLevel.DEFAULT_LEVEL));
      } else {
        classified.add(element);
      }
    }
    if (pending.isEmpty()) {
      return classified;
    }

    List<ClassificationResult> results = classifier.classifyAll(texts);
    int headings = 0;
    for (int i = 0; i < pending.size(); i++) {
      ClassificationResult result = results.get(i);
      int index = pending.get(i);
      classified.set(
          index, elements.get(index).withClassification(result.heading(), result.level()));
      if (result.heading()) {
        headings++;
      }
    }
    log.debug("Classified {} paragraphs, {} detected as headings", pending.size(), headings);
    return classified;
  }

  /**
   * Cuts unclassified paragraphs holding more than one legal unit into one heading element per
   * marker, each followed by its body as content. A paragraph that starts with its only marker is
   * left for the classifier. Text before the first marker stays an unclassified paragraph.
   */
  static List<Element> splitInlineSections(List<Element> elements) {
    List<Element> out = new ArrayList<>(elements.size());
    int split = 0;
    for (Element element : elements) {
      String text = element.text().strip();
      List<HeadingPatternTable.InlineSection> sections =
          element.isUnclassified() ? MARKERS.extractSections(text) : List.of();
      boolean multiUnit =
          sections.size() > 1 || (sections.size() == 1 && sections.get(0).start() > 0);
      if (!multiUnit) {
        out.add(element);
        continue;
      }

      split++;
      String preamble = text.substring(0, sections.get(0).start()).strip();
      if (!preamble.isEmpty()) {
        out.add(Element.paragraph(preamble));
      }
      for (HeadingPatternTable.InlineSection section : sections) {
        addSection(section, out);
      }
    }
    if (split > 0) {
      log.debug("Cut {} paragraphs at inline legal markers", split);
    }
    return out;
  }

  private static void addSection(HeadingPatternTable.InlineSection section, List<Element> out) {
    String body = section.text();
    int lineBreak = body.indexOf('\n');
    String heading;
    String content;
    if (lineBreak >= 0) {
      heading = body.substring(0, lineBreak).strip();
      content = body.substring(lineBreak + 1).strip();
    } else if (body.chars().noneMatch(c -> TERMINATORS.indexOf(c) >= 0)) {
      // A title such as 第一章 总则
      heading = body;
      content = "";
    } else {
      heading = section.marker();
      content = body.substring(section.marker().length()).strip();
    }
    out.add(Element.heading(heading, section.level().getValue()));
    if (!content.isEmpty()) {
      out.add(Element.content(content));
    }
  }
}
