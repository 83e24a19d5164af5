package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.model.ChunkingWarning;
import java.util.List;

/**
 * Pieces produced by {@link SizeConstrainedSplitter}, plus any degradations it absorbed.
 *
 * @param pieces contiguous substrings of the input, in order
 * @param warnings oversized sentences and raw overlaps; empty in the common case
 */
public record SplitResult(List<String> pieces, List<ChunkingWarning> warnings) {

  public SplitResult {
    pieces = List.copyOf(pieces);
    warnings = List.copyOf(warnings);
  }

  static SplitResult of(String piece) {
    return new SplitResult(List.of(piece), List.of());
  }

  static SplitResult empty() {
    return new SplitResult(List.of(), List.of());
  }
}
