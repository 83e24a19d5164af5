package com.flamingo.ai.contractsplitter.agent.dto;

import java.util.List;

/**
 * Structured JSON output from HeadingClassificationAgent. Holds one verdict per submitted fragment,
 * in submission order.
 */
public record HeadingClassifications(List<HeadingVerdict> results) {

  /** Verdict for a single fragment. */
  public record HeadingVerdict(boolean isHeading, int level, double confidence) {}
}
