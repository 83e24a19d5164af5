package com.flamingo.ai.contractsplitter.model;

import com.flamingo.ai.contractsplitter.service.classification.HeadingLevel;

/**
 * A single text fragment produced by an upstream document extractor, in reading order.
 *
 * <p>Extractors that can read heading information from the source format (e.g. a DOCX "Heading 2"
 * style) set {@code heading} and {@code level} themselves. Fragments they cannot classify carry
 * {@link #UNSET_LEVEL} and are passed through a {@link
 * com.flamingo.ai.contractsplitter.service.classification.HeadingClassifier} before the hierarchy
 * is built.
 *
 * @param text trimmed fragment text
 * @param heading whether the fragment is a heading
 * @param level hierarchy level (1 = highest), or {@link #UNSET_LEVEL}
 * @param kind paragraph, table cell or heading
 * @param sourceTag optional extractor-specific tag (style name, cell coordinates, …); may be null
 */
public record Element(String text, boolean heading, int level, ElementKind kind, String sourceTag) {

  /** Level value for fragments the extractor could not classify. */
  public static final int UNSET_LEVEL = 0;

  public Element {
    text = text == null ? "" : text;
    kind = kind == null ? ElementKind.PARAGRAPH : kind;
  }

  public static Element heading(String text, int level) {
    return new Element(text, true, level, ElementKind.HEADING, null);
  }

  /** An unclassified paragraph; its level is resolved by the heading classifier. */
  public static Element paragraph(String text) {
    return new Element(text, false, UNSET_LEVEL, ElementKind.PARAGRAPH, null);
  }

  /** A paragraph the extractor already knows to be plain content. */
  public static Element content(String text) {
    return new Element(text, false, HeadingLevel.DEFAULT_LEVEL, ElementKind.PARAGRAPH, null);
  }

  public static Element tableCell(String text, String sourceTag) {
    return new Element(text, false, HeadingLevel.DEFAULT_LEVEL, ElementKind.TABLE_CELL, sourceTag);
  }

  /** Returns {@code true} if this element still needs a classification pass. */
  public boolean isUnclassified() {
    return !heading && level == UNSET_LEVEL && kind == ElementKind.PARAGRAPH;
  }

  public Element withClassification(boolean isHeading, int newLevel) {
    return new Element(
        text, isHeading, newLevel, isHeading ? ElementKind.HEADING : kind, sourceTag);
  }
}
