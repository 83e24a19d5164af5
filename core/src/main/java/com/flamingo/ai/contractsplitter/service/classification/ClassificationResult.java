package com.flamingo.ai.contractsplitter.service.classification;

/**
 * Outcome of classifying one text fragment.
 *
 * @param heading whether the fragment is a heading
 * @param level hierarchy level; {@link HeadingLevel#DEFAULT_LEVEL} for plain content
 * @param confidence classifier confidence in {@code [0, 1]}; the pattern classifier always reports
 *     {@code 1.0}
 */
public record ClassificationResult(boolean heading, int level, double confidence) {

  private static final ClassificationResult NOT_HEADING =
      new ClassificationResult(false, HeadingLevel.DEFAULT_LEVEL, 1.0);

  public ClassificationResult {
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  public static ClassificationResult heading(int level) {
    return new ClassificationResult(true, level, 1.0);
  }

  public static ClassificationResult heading(HeadingLevel level) {
    return heading(level.getValue());
  }

  public static ClassificationResult notHeading() {
    return NOT_HEADING;
  }
}
