package com.flamingo.ai.contractsplitter.service.classification;

import java.util.List;

/**
 * Decides whether a text fragment is a heading and at which hierarchy level.
 *
 * <p>Implementations may be rule-based ({@link PatternHeadingClassifier}) or call a remote model
 * ({@link LlmHeadingClassifier}). Downstream components depend only on this interface, so
 * classifiers can be swapped without touching the hierarchy builder or the chunker.
 *
 * <p>Implementations must be safe for concurrent use and must not throw for any input text.
 */
public interface HeadingClassifier {

  /**
   * Classifies a single, already-trimmed fragment.
   *
   * @param text the fragment
   * @return classification result, never null
   */
  ClassificationResult classify(String text);

  /**
   * Classifies several fragments at once, preserving order. Remote classifiers override this to
   * batch requests.
   *
   * @param texts fragments in document order
   * @return one result per fragment, in the same order
   */
  default List<ClassificationResult> classifyAll(List<String> texts) {
    return texts.stream().map(this::classify).toList();
  }
}
