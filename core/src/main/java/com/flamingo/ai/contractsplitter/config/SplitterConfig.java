package com.flamingo.ai.contractsplitter.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the document chunking pipeline. */
@Configuration
@ConfigurationProperties(prefix = "splitter")
@Getter
@Setter
public class SplitterConfig {

  /** Document profile whose presets apply: legal, contract, regulation or general. */
  private String documentType = "general";

  private Chunking chunking = new Chunking();
  private Classification classification = new Classification();
  private Dedup dedup = new Dedup();
  private Llm llm = new Llm();

  @Getter
  @Setter
  public static class Chunking {
    /** Upper bound per chunk, in units of {@link #sizeUnit}. */
    private int maxSize = 2000;

    private int overlap = 200;
    private boolean bySentence = true;

    /** "character" (default) or "token". */
    private String sizeUnit = "character";

    /** Model whose tokenizer is used when {@code sizeUnit=token}. */
    private String tokenizerModel = "gpt-4";

    /** finest_granularity, all_levels or parent_only. */
    private String strategy = "finest_granularity";

    /** Force every flattened chunk through the size-constrained splitter. */
    private boolean strictSizing = false;
  }

  @Getter
  @Setter
  public static class Classification {
    private boolean fuzzyMatchingEnabled = true;
    private int fuzzyMaxLength = 30;
    private int articleMaxLength = 50;

    /**
     * Extra prefix patterns keyed by heading level name (book, part, chapter, section, article,
     * clause, item, subitem, paragraph, enumeration, numbering).
     */
    private Map<String, List<String>> customPatterns = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class Dedup {
    private boolean enabled = true;
    private double threshold = 0.7;
  }

  /** Remote heading classifier backed by an OpenAI-compatible chat model. */
  @Getter
  @Setter
  public static class Llm {
    private boolean enabled = false;
    private String apiKey = "";
    private String baseUrl = "https://api.openai.com/v1";
    private String modelName = "gpt-4o-mini";
    private double temperature = 0.1;
    private int maxCompletionTokens = 1000;

    private int batchSize = 20;
    private int maxTokensPerBatch = 3000;

    /** Hard deadline for one batch call, including retries waiting inside it. */
    private long timeoutMs = 30_000;

    private int maxAttempts = 3;
    private long retryWaitMs = 500;

    private boolean cacheEnabled = true;
    private long cacheMaxSize = 10_000;
  }
}
