package com.flamingo.ai.contractsplitter.service.chunking;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds sentence spans in mixed Chinese and Western text.
 *
 * <p>A sentence ends at {@code . ! ? ;} or their full-width forms {@code 。！？；}. Runs of
 * terminators and any closing quotes or brackets that follow them stay with the sentence. A period
 * directly followed by a digit is a decimal point, not a terminator. Text after the last terminator
 * forms a final sentence.
 */
final class SentenceSegmenter {

  private static final String TERMINATORS = ".!?;。！？；";
  private static final String CLOSERS = "”’\"'）)】]》」』";

  /** Half-open {@code [start, end)} character range of one sentence. */
  record Span(int start, int end) {}

  private SentenceSegmenter() {}

  static List<Span> segment(String text) {
    List<Span> spans = new ArrayList<>();
    int length = text.length();
    int start = skipWhitespace(text, 0);

    int i = start;
    while (i < length) {
      if (isTerminatorAt(text, i)) {
        int end = i + 1;
        while (end < length
            && (isTerminatorAt(text, end) || CLOSERS.indexOf(text.charAt(end)) >= 0)) {
          end++;
        }
        spans.add(new Span(start, end));
        start = skipWhitespace(text, end);
        i = start;
      } else {
        i++;
      }
    }

    if (start < length) {
      int end = length;
      while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
        end--;
      }
      spans.add(new Span(start, end));
    }
    return spans;
  }

  private static boolean isTerminatorAt(String text, int index) {
    char c = text.charAt(index);
    if (TERMINATORS.indexOf(c) < 0) {
      return false;
    }
    return c != '.' || index + 1 >= text.length() || !Character.isDigit(text.charAt(index + 1));
  }

  private static int skipWhitespace(String text, int from) {
    int i = from;
    while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
      i++;
    }
    return i;
  }
}
