package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.model.ChunkingWarning;
import java.util.List;

/** Chunks produced from a section forest, with the warnings raised while sizing them. */
public record FlattenResult(List<String> chunks, List<ChunkingWarning> warnings) {

  public FlattenResult {
    chunks = List.copyOf(chunks);
    warnings = List.copyOf(warnings);
  }
}
