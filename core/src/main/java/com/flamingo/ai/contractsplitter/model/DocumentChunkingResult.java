package com.flamingo.ai.contractsplitter.model;

import java.util.List;

/**
 * The composite result of running the chunking pipeline on one document.
 *
 * @param sections the section forest, for callers that want the hierarchical view
 * @param chunks final chunks after sizing and de-duplication
 * @param warnings degradations absorbed along the way; empty when everything went to plan
 * @param duplicatesRemoved number of chunks dropped as near-duplicates
 */
public record DocumentChunkingResult(
    List<Section> sections,
    List<String> chunks,
    List<ChunkingWarning> warnings,
    int duplicatesRemoved) {

  public DocumentChunkingResult {
    sections = List.copyOf(sections);
    chunks = List.copyOf(chunks);
    warnings = List.copyOf(warnings);
  }

  public static DocumentChunkingResult empty() {
    return new DocumentChunkingResult(List.of(), List.of(), List.of(), 0);
  }
}
