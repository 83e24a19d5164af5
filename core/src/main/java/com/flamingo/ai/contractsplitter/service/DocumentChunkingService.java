package com.flamingo.ai.contractsplitter.service;

import com.flamingo.ai.contractsplitter.config.SplitterConfig;
import com.flamingo.ai.contractsplitter.model.ChunkingWarning;
import com.flamingo.ai.contractsplitter.model.DocumentChunkingResult;
import com.flamingo.ai.contractsplitter.model.Element;
import com.flamingo.ai.contractsplitter.model.Section;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkDeduplicator;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkFlattener;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkingOptions;
import com.flamingo.ai.contractsplitter.service.chunking.FlattenResult;
import com.flamingo.ai.contractsplitter.service.classification.ElementClassifier;
import com.flamingo.ai.contractsplitter.service.classification.HeadingClassifier;
import com.flamingo.ai.contractsplitter.service.hierarchy.HierarchyBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the chunking pipeline for one document: classify unclassified elements, build the section
 * hierarchy, flatten it into chunks and drop near-duplicates.
 *
 * <p>Holds no per-document state, so documents can be processed concurrently. Only invalid
 * configuration fails a call; content problems are reported as {@link ChunkingWarning}s.
 */
@Service
@Slf4j
public class DocumentChunkingService {

  private final HeadingClassifier headingClassifier;
  private final HeadingClassifier ruleBasedClassifier;
  private final HierarchyBuilder hierarchyBuilder;
  private final ChunkFlattener chunkFlattener;
  private final ChunkDeduplicator chunkDeduplicator;
  private final ChunkingOptions boundOptions;
  private final MeterRegistry meterRegistry;

  public DocumentChunkingService(
      HeadingClassifier headingClassifier,
      @Qualifier("ruleBasedHeadingClassifier") HeadingClassifier ruleBasedClassifier,
      HierarchyBuilder hierarchyBuilder,
      ChunkFlattener chunkFlattener,
      ChunkDeduplicator chunkDeduplicator,
      SplitterConfig splitterConfig,
      MeterRegistry meterRegistry) {
    this.headingClassifier = headingClassifier;
    this.ruleBasedClassifier = ruleBasedClassifier;
    this.hierarchyBuilder = hierarchyBuilder;
    this.chunkFlattener = chunkFlattener;
    this.chunkDeduplicator = chunkDeduplicator;
    this.boundOptions = ChunkingOptions.fromConfig(splitterConfig);
    this.meterRegistry = meterRegistry;
  }

  /** Processes a document with the options bound once from {@code splitter.*} properties. */
  public DocumentChunkingResult process(List<Element> elements) {
    return process(elements, boundOptions);
  }

  public DocumentChunkingResult process(List<Element> elements, ChunkingOptions options) {
    return process(elements, options, headingClassifier);
  }

  /**
   * Processes a document with an explicit classifier, e.g. one built for a specific {@link
   * com.flamingo.ai.contractsplitter.config.DocumentProfile}.
   *
   * @param elements extracted elements in reading order
   * @param options chunking options
   * @param classifier classifier for elements the extractor left unclassified
   * @return sections, final chunks and warnings
   * @throws com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException if the
   *     options are invalid
   */
  public DocumentChunkingResult process(
      List<Element> elements, ChunkingOptions options, HeadingClassifier classifier) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return doProcess(elements, options, classifier);
    } finally {
      sample.stop(meterRegistry.timer("splitter.document.process"));
    }
  }

  private DocumentChunkingResult doProcess(
      List<Element> elements, ChunkingOptions options, HeadingClassifier classifier) {
    options.validate();
    if (elements == null || elements.isEmpty()) {
      log.debug("No elements to chunk");
      return DocumentChunkingResult.empty();
    }

    List<ChunkingWarning> warnings = new ArrayList<>();
    List<Element> classified = classifyElements(elements, classifier, warnings);
    List<Section> sections = hierarchyBuilder.build(classified);
    DocumentChunkingResult result = chunk(sections, options, warnings);

    meterRegistry.counter("splitter.documents.processed").increment();
    log.info(
        "Chunked document: {} elements -> {} root sections -> {} chunks ({} duplicates removed,"
            + " {} warnings)",
        elements.size(),
        sections.size(),
        result.chunks().size(),
        result.duplicatesRemoved(),
        result.warnings().size());
    return result;
  }

  /** Chunks an already-built section forest, skipping classification and hierarchy building. */
  public DocumentChunkingResult chunkSections(List<Section> sections, ChunkingOptions options) {
    options.validate();
    return chunk(sections, options, new ArrayList<>());
  }

  private DocumentChunkingResult chunk(
      List<Section> sections, ChunkingOptions options, List<ChunkingWarning> warnings) {
    FlattenResult flattened = chunkFlattener.flatten(sections, options);
    warnings.addAll(flattened.warnings());

    List<String> chunks = flattened.chunks();
    int duplicatesRemoved = 0;
    if (options.isDedupEnabled()) {
      List<String> unique = chunkDeduplicator.dedup(chunks, options.getDedupThreshold());
      duplicatesRemoved = chunks.size() - unique.size();
      chunks = unique;
    }

    recordMetrics(chunks.size(), duplicatesRemoved, warnings);
    return new DocumentChunkingResult(sections, chunks, warnings, duplicatesRemoved);
  }

  private List<Element> classifyElements(
      List<Element> elements, HeadingClassifier classifier, List<ChunkingWarning> warnings) {
    try {
      return ElementClassifier.classify(elements, classifier);
    } catch (RuntimeException e) {
      if (classifier == ruleBasedClassifier) {
        throw e;
      }
      log.warn("Heading classifier failed: {}, using rule-based classifier", e.getMessage());
      meterRegistry.counter("splitter.classification.fallbacks").increment();
      warnings.add(
          ChunkingWarning.of(
              ChunkingWarning.Type.CLASSIFIER_FALLBACK,
              "Heading classifier failed, rule-based classification used",
              String.valueOf(e.getMessage())));
      return ElementClassifier.classify(elements, ruleBasedClassifier);
    }
  }

  private void recordMetrics(
      int chunkCount, int duplicatesRemoved, List<ChunkingWarning> warnings) {
    meterRegistry.counter("splitter.chunks.produced").increment(chunkCount);
    if (duplicatesRemoved > 0) {
      meterRegistry.counter("splitter.chunks.duplicates_removed").increment(duplicatesRemoved);
    }
    long oversized =
        warnings.stream()
            .filter(w -> w.type() == ChunkingWarning.Type.OVERSIZED_SENTENCE)
            .count();
    if (oversized > 0) {
      meterRegistry.counter("splitter.chunks.oversized").increment(oversized);
    }
  }
}
