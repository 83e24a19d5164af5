package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.config.DocumentProfile;
import com.flamingo.ai.contractsplitter.config.SplitterConfig;
import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;

/** Per-call chunking parameters. */
@Value
@Builder(toBuilder = true)
public class ChunkingOptions {

  public static final String SIZE_UNIT_CHARACTER = "character";
  public static final String SIZE_UNIT_TOKEN = "token";

  @Builder.Default int maxSize = 2000;

  @Builder.Default int overlap = 200;

  @Builder.Default boolean bySentence = true;

  @Builder.Default SizeFunction sizeFunction = SizeFunction.characters();

  @Builder.Default ChunkingStrategy strategy = ChunkingStrategy.FINEST_GRANULARITY;

  /** Force every flattened chunk through the splitter instead of emitting sections whole. */
  @Builder.Default boolean strictSizing = false;

  @Builder.Default boolean dedupEnabled = true;

  @Builder.Default double dedupThreshold = ChunkDeduplicator.DEFAULT_THRESHOLD;

  public static ChunkingOptions defaults() {
    return ChunkingOptions.builder().build();
  }

  /** Defaults with the size and strictness presets of a document profile. */
  public static ChunkingOptions forProfile(DocumentProfile profile) {
    return ChunkingOptions.builder()
        .maxSize(profile.getMaxSize())
        .overlap(profile.getOverlap())
        .strictSizing(profile.isStrictSizing())
        .build();
  }

  /**
   * Options from bound configuration. Explicit chunking properties win; strict sizing is enabled
   * when either the property or the document profile asks for it.
   */
  public static ChunkingOptions fromConfig(SplitterConfig config) {
    DocumentProfile profile = DocumentProfile.fromValue(config.getDocumentType());
    SplitterConfig.Chunking chunking = config.getChunking();
    ChunkingOptions options =
        ChunkingOptions.builder()
            .maxSize(chunking.getMaxSize())
            .overlap(chunking.getOverlap())
            .bySentence(chunking.isBySentence())
            .sizeFunction(sizeFunction(chunking.getSizeUnit(), chunking.getTokenizerModel()))
            .strategy(ChunkingStrategy.fromValue(chunking.getStrategy()))
            .strictSizing(chunking.isStrictSizing() || profile.isStrictSizing())
            .dedupEnabled(config.getDedup().isEnabled())
            .dedupThreshold(config.getDedup().getThreshold())
            .build();
    options.validate();
    return options;
  }

  static SizeFunction sizeFunction(String sizeUnit, String tokenizerModel) {
    String unit = sizeUnit == null ? "" : sizeUnit.trim().toLowerCase(Locale.ROOT);
    return switch (unit) {
      case SIZE_UNIT_CHARACTER -> SizeFunction.characters();
      case SIZE_UNIT_TOKEN -> new TokenCountSizeFunction(tokenizerModel);
      default ->
          throw ChunkingConfigurationException.unknownValue(
              "size unit", sizeUnit, List.of(SIZE_UNIT_CHARACTER, SIZE_UNIT_TOKEN));
    };
  }

  /**
   * Checks sizes and thresholds.
   *
   * @throws ChunkingConfigurationException if any value is out of range
   */
  public void validate() {
    SizeConstrainedSplitter.validate(maxSize, overlap);
    ChunkDeduplicator.validateThreshold(dedupThreshold);
    if (strategy == null) {
      throw ChunkingConfigurationException.unknownValue(
          "chunking strategy", null, ChunkingStrategy.validValues());
    }
    if (sizeFunction == null) {
      throw new ChunkingConfigurationException("size function", null, "Size function is required");
    }
  }
}
