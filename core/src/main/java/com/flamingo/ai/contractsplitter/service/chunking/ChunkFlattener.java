package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.model.ChunkingWarning;
import com.flamingo.ai.contractsplitter.model.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a section forest into text chunks.
 *
 * <p>The forest is walked depth-first. Each emitted chunk carries the heading path of its section
 * ({@code "第一章 总则 > 第一条 X"}) so it stays interpretable out of context. Which sections emit
 * is decided by the {@link ChunkingStrategy}; sections are never split here unless strict sizing is
 * requested through {@link #flatten(List, ChunkingOptions)}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkFlattener {

  static final String PATH_SEPARATOR = " > ";
  static final String HEADING_SEPARATOR = "\n\n";

  private final SizeConstrainedSplitter splitter;

  /**
   * Flattens with a strategy given by name.
   *
   * @throws com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException if the name
   *     is not a known strategy
   */
  public List<String> flatten(List<Section> sections, String strategy) {
    return flatten(sections, ChunkingStrategy.fromValue(strategy));
  }

  public List<String> flatten(List<Section> sections, ChunkingStrategy strategy) {
    List<String> chunks = new ArrayList<>();
    walkSections(sections, "", strategy, chunks);
    return chunks;
  }

  /**
   * Flattens with the strategy from {@code options}. When strict sizing is on, each chunk is
   * passed through the {@link SizeConstrainedSplitter} and replaced in place by its pieces.
   */
  public FlattenResult flatten(List<Section> sections, ChunkingOptions options) {
    options.validate();
    List<String> chunks = flatten(sections, options.getStrategy());
    if (!options.isStrictSizing()) {
      return new FlattenResult(chunks, List.of());
    }

    List<String> sized = new ArrayList<>(chunks.size());
    List<ChunkingWarning> warnings = new ArrayList<>();
    for (String chunk : chunks) {
      SplitResult split =
          splitter.split(
              chunk,
              options.getMaxSize(),
              options.getOverlap(),
              options.isBySentence(),
              options.getSizeFunction());
      sized.addAll(split.pieces());
      warnings.addAll(split.warnings());
    }
    if (sized.size() > chunks.size()) {
      log.debug("Strict sizing split {} chunks into {}", chunks.size(), sized.size());
    }
    return new FlattenResult(sized, warnings);
  }

  // ---- recursive section walk ----

  private void walkSections(
      List<Section> sections, String parentPath, ChunkingStrategy strategy, List<String> out) {
    for (Section section : sections) {
      String fullHeading = joinPath(parentPath, section.heading());

      boolean emits = strategy == ChunkingStrategy.ALL_LEVELS || section.isLeaf();
      if (emits) {
        render(section, fullHeading).ifPresent(out::add);
      }
      walkSections(section.subsections(), fullHeading, strategy, out);
    }
  }

  private Optional<String> render(Section section, String fullHeading) {
    String heading = section.heading();
    String content = section.content().strip();

    if (content.isEmpty()) {
      boolean headingOnly = section.isLeaf() && !fullHeading.isEmpty();
      return headingOnly ? Optional.of(fullHeading) : Optional.empty();
    }
    if (!heading.isEmpty() && content.startsWith(heading)) {
      return Optional.of(fullHeading + content.substring(heading.length()));
    }
    if (fullHeading.isEmpty()) {
      return Optional.of(content);
    }
    return Optional.of(fullHeading + HEADING_SEPARATOR + content);
  }

  private static String joinPath(String parentPath, String heading) {
    if (parentPath.isEmpty()) {
      return heading;
    }
    if (heading.isEmpty()) {
      return parentPath;
    }
    return parentPath + PATH_SEPARATOR + heading;
  }
}
