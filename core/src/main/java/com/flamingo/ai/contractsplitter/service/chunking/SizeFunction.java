package com.flamingo.ai.contractsplitter.service.chunking;

/** Measures text in the unit chunk sizes are expressed in. */
@FunctionalInterface
public interface SizeFunction {

  int measure(String text);

  /** Counts Unicode code points, so a CJK character or an emoji is one unit. */
  static SizeFunction characters() {
    return text -> text.codePointCount(0, text.length());
  }
}
