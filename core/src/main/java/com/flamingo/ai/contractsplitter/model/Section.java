package com.flamingo.ai.contractsplitter.model;

import java.util.List;

/**
 * A node in the hierarchical structure of a document.
 *
 * <p>Sections are produced by {@link
 * com.flamingo.ai.contractsplitter.service.hierarchy.HierarchyBuilder} and are read-only
 * afterwards.
 *
 * @param heading heading text ({@code "Document Content"} for the synthetic root)
 * @param content heading text followed by the text of all directly contained non-heading
 *     elements, separated by blank lines; never includes sub-section content
 * @param level hierarchy level (1 = highest); always lower than every child's level
 * @param subsections child sections in document order
 */
public record Section(String heading, String content, int level, List<Section> subsections) {

  public Section {
    heading = heading == null ? "" : heading;
    content = content == null ? "" : content;
    subsections = subsections == null ? List.of() : List.copyOf(subsections);
  }

  public static Section leaf(String heading, String content, int level) {
    return new Section(heading, content, level, List.of());
  }

  public boolean isLeaf() {
    return subsections.isEmpty();
  }
}
