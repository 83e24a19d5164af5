package com.flamingo.ai.contractsplitter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contractsplitter.config.SplitterConfig;
import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import com.flamingo.ai.contractsplitter.model.ChunkingWarning;
import com.flamingo.ai.contractsplitter.model.DocumentChunkingResult;
import com.flamingo.ai.contractsplitter.model.Element;
import com.flamingo.ai.contractsplitter.model.Section;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkDeduplicator;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkFlattener;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkingOptions;
import com.flamingo.ai.contractsplitter.service.chunking.ChunkingStrategy;
import com.flamingo.ai.contractsplitter.service.chunking.SizeConstrainedSplitter;
import com.flamingo.ai.contractsplitter.service.classification.HeadingClassifier;
import com.flamingo.ai.contractsplitter.service.classification.PatternHeadingClassifier;
import com.flamingo.ai.contractsplitter.service.hierarchy.HierarchyBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentChunkingService Tests")
class DocumentChunkingServiceTest {

  private static final List<Element> CONTRACT =
      List.of(
          Element.paragraph("第一章 总则"),
          Element.paragraph("本章规定合同的一般原则。"),
          Element.paragraph("第一条 定义"),
          Element.paragraph("本合同中的术语具有以下含义。"),
          Element.paragraph("第二条 适用范围"),
          Element.paragraph("本合同适用于双方之间的全部采购交易。"));

  @Mock private HeadingClassifier remoteClassifier;

  private SimpleMeterRegistry meterRegistry;
  private SplitterConfig splitterConfig;
  private PatternHeadingClassifier ruleBasedClassifier;
  private DocumentChunkingService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    splitterConfig = new SplitterConfig();
    ruleBasedClassifier = PatternHeadingClassifier.defaults();
    service = newService();
  }

  private DocumentChunkingService newService() {
    return new DocumentChunkingService(
        ruleBasedClassifier,
        ruleBasedClassifier,
        new HierarchyBuilder(),
        new ChunkFlattener(new SizeConstrainedSplitter()),
        new ChunkDeduplicator(),
        splitterConfig,
        meterRegistry);
  }

  @Test
  @DisplayName("should classify, build the hierarchy and emit leaf chunks")
  void shouldRunFullPipeline() {
    DocumentChunkingResult result = service.process(CONTRACT, ChunkingOptions.defaults());

    assertThat(result.sections()).hasSize(1);
    Section chapter = result.sections().get(0);
    assertThat(chapter.content()).isEqualTo("第一章 总则\n\n本章规定合同的一般原则。");
    assertThat(chapter.subsections())
        .extracting(Section::heading)
        .containsExactly("第一条 定义", "第二条 适用范围");
    assertThat(result.chunks())
        .containsExactly(
            "第一章 总则 > 第一条 定义\n\n本合同中的术语具有以下含义。",
            "第一章 总则 > 第二条 适用范围\n\n本合同适用于双方之间的全部采购交易。");
    assertThat(result.warnings()).isEmpty();
    assertThat(result.duplicatesRemoved()).isZero();
  }

  @Test
  @DisplayName("should use the bound configuration when no options are given")
  void shouldUseBoundConfiguration() {
    splitterConfig.getChunking().setStrategy("all_levels");

    DocumentChunkingResult result = newService().process(CONTRACT);

    assertThat(result.chunks()).hasSize(3);
    assertThat(result.chunks().get(0)).isEqualTo("第一章 总则\n\n本章规定合同的一般原则。");
  }

  @Test
  @DisplayName("should return an empty result for an empty document")
  void shouldReturnEmptyResultForEmptyDocument() {
    DocumentChunkingResult result = service.process(List.of(), ChunkingOptions.defaults());

    assertThat(result).isEqualTo(DocumentChunkingResult.empty());
  }

  @Test
  @DisplayName("should drop near-duplicate chunks and count them")
  void shouldDropNearDuplicates() {
    List<Element> elements =
        List.of(
            Element.heading("Annex A", 2),
            Element.content("Unit price table header row"),
            Element.heading("Annex B", 2),
            Element.content("Unit price table header row"));

    DocumentChunkingResult result = service.process(elements, ChunkingOptions.defaults());

    assertThat(result.chunks()).containsExactly("Annex A\n\nUnit price table header row");
    assertThat(result.duplicatesRemoved()).isEqualTo(1);
    assertThat(meterRegistry.counter("splitter.chunks.duplicates_removed").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should keep duplicates when deduplication is disabled")
  void shouldKeepDuplicatesWhenDisabled() {
    List<Element> elements =
        List.of(
            Element.heading("Annex A", 2),
            Element.content("Unit price table header row"),
            Element.heading("Annex B", 2),
            Element.content("Unit price table header row"));
    ChunkingOptions options = ChunkingOptions.builder().dedupEnabled(false).build();

    assertThat(service.process(elements, options).chunks()).hasSize(2);
  }

  @Test
  @DisplayName("should fall back to rules when the classifier throws")
  void shouldFallBackWhenClassifierThrows() {
    when(remoteClassifier.classifyAll(anyList())).thenThrow(new IllegalStateException("offline"));

    DocumentChunkingResult result =
        service.process(CONTRACT, ChunkingOptions.defaults(), remoteClassifier);

    assertThat(result.chunks()).hasSize(2);
    assertThat(result.warnings())
        .extracting(ChunkingWarning::type)
        .containsExactly(ChunkingWarning.Type.CLASSIFIER_FALLBACK);
    assertThat(meterRegistry.counter("splitter.classification.fallbacks").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should split oversized sections under strict sizing and report warnings")
  void shouldEnforceStrictSizing() {
    List<Element> elements =
        List.of(
            Element.heading("第一条 交付", 5),
            Element.content("卖方应于合同生效后十日内交付货物。买方应当及时验收。"),
            Element.content("逾期交付的卖方应当按日支付违约金且该违约金的计算基数为合同总价款的百分之一"));
    ChunkingOptions options =
        ChunkingOptions.builder().maxSize(30).overlap(0).strictSizing(true).build();

    DocumentChunkingResult result = service.process(elements, options);

    assertThat(result.chunks()).hasSizeGreaterThan(1);
    assertThat(result.chunks().get(0)).startsWith("第一条 交付");
    assertThat(result.warnings())
        .extracting(ChunkingWarning::type)
        .contains(ChunkingWarning.Type.OVERSIZED_SENTENCE);
    assertThat(meterRegistry.counter("splitter.chunks.oversized").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should record produced chunks")
  void shouldRecordMetrics() {
    service.process(CONTRACT, ChunkingOptions.defaults());
    service.process(CONTRACT, ChunkingOptions.defaults());

    assertThat(meterRegistry.counter("splitter.documents.processed").count()).isEqualTo(2.0);
    assertThat(meterRegistry.counter("splitter.chunks.produced").count()).isEqualTo(4.0);
  }

  @Test
  @DisplayName("should time every processed document")
  void shouldTimeProcessing() {
    service.process(CONTRACT);
    service.process(CONTRACT, ChunkingOptions.defaults());

    assertThat(meterRegistry.find("splitter.document.process").timer()).isNotNull();
    assertThat(meterRegistry.timer("splitter.document.process").count()).isEqualTo(2);
  }

  @Test
  @DisplayName("should bind configured options once at construction")
  void shouldBindOptionsOnce() {
    splitterConfig.getChunking().setStrategy("all_levels");

    DocumentChunkingResult result = service.process(CONTRACT);

    assertThat(result.chunks()).hasSize(2);
  }

  @Test
  @DisplayName("should fail at construction on an invalid bound configuration")
  void shouldFailOnInvalidBoundConfiguration() {
    splitterConfig.getChunking().setStrategy("sentences");

    assertThatThrownBy(this::newService).isInstanceOf(ChunkingConfigurationException.class);
  }

  @Test
  @DisplayName("should chunk articles run together in one extracted block")
  void shouldChunkInlineArticles() {
    List<Element> elements =
        List.of(
            Element.paragraph("第一章 总则"),
            Element.paragraph("第一条 为了规范合同，制定本法。第二条 合同自双方签字之日起生效。"));

    DocumentChunkingResult result = service.process(elements, ChunkingOptions.defaults());

    assertThat(result.chunks())
        .containsExactly(
            "第一章 总则 > 第一条\n\n为了规范合同，制定本法。", "第一章 总则 > 第二条\n\n合同自双方签字之日起生效。");
  }

  @Test
  @DisplayName("should chunk a prebuilt section forest")
  void shouldChunkPrebuiltSections() {
    List<Section> sections = List.of(Section.leaf("Recitals", "Recitals\n\nWhereas.", 2));
    ChunkingOptions options =
        ChunkingOptions.builder().strategy(ChunkingStrategy.ALL_LEVELS).build();

    DocumentChunkingResult result = service.chunkSections(sections, options);

    assertThat(result.chunks()).containsExactly("Recitals\n\nWhereas.");
    assertThat(result.sections()).isEqualTo(sections);
  }

  @Test
  @DisplayName("should fail fast on invalid options")
  void shouldFailOnInvalidOptions() {
    ChunkingOptions options = ChunkingOptions.builder().maxSize(10).overlap(-1).build();

    assertThatThrownBy(() -> service.process(CONTRACT, options))
        .isInstanceOf(ChunkingConfigurationException.class);
  }
}
