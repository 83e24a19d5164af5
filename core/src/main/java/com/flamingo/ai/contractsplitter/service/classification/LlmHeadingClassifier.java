package com.flamingo.ai.contractsplitter.service.classification;

import com.flamingo.ai.contractsplitter.agent.HeadingClassificationAgent;
import com.flamingo.ai.contractsplitter.agent.dto.HeadingClassifications;
import com.flamingo.ai.contractsplitter.agent.dto.HeadingClassifications.HeadingVerdict;
import com.flamingo.ai.contractsplitter.config.SplitterConfig;
import com.flamingo.ai.contractsplitter.exception.LlmServiceException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.hash.Hashing;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

/**
 * Heading classifier backed by a chat model through {@link HeadingClassificationAgent}.
 *
 * <p>Fragments are sent in batches bounded both by count and by an estimated token budget. Each
 * batch call is retried, bounded by a hard deadline and guarded by a circuit breaker. A batch that
 * still fails is classified by the rule-based fallback instead, so a document is always fully
 * classified.
 *
 * <p>Successful verdicts are cached by content hash.
 */
@Slf4j
public class LlmHeadingClassifier implements HeadingClassifier {

  private static final int MAX_FRAGMENT_CHARS = 500;

  private final HeadingClassificationAgent agent;
  private final HeadingClassifier fallback;
  private final MeterRegistry meterRegistry;
  private final AsyncTaskExecutor executor;
  private final int batchSize;
  private final int maxTokensPerBatch;
  private final Cache<String, ClassificationResult> cache;
  private final Retry retry;
  private final TimeLimiter timeLimiter;
  private final CircuitBreaker circuitBreaker;

  public LlmHeadingClassifier(
      HeadingClassificationAgent agent,
      HeadingClassifier fallback,
      MeterRegistry meterRegistry,
      AsyncTaskExecutor executor,
      SplitterConfig.Llm settings) {
    this.agent = agent;
    this.fallback = fallback;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
    this.batchSize = Math.max(1, settings.getBatchSize());
    this.maxTokensPerBatch = Math.max(1, settings.getMaxTokensPerBatch());
    this.cache =
        settings.isCacheEnabled()
            ? CacheBuilder.newBuilder().maximumSize(settings.getCacheMaxSize()).build()
            : null;
    this.retry =
        Retry.of(
            "headingClassification",
            RetryConfig.custom()
                .maxAttempts(Math.max(1, settings.getMaxAttempts()))
                .waitDuration(Duration.ofMillis(settings.getRetryWaitMs()))
                .build());
    this.timeLimiter =
        TimeLimiter.of(
            TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(settings.getTimeoutMs()))
                .cancelRunningFuture(true)
                .build());
    this.circuitBreaker = CircuitBreaker.ofDefaults("headingClassification");
  }

  @Override
  public ClassificationResult classify(String text) {
    return classifyAll(List.of(text)).get(0);
  }

  @Override
  @Timed(value = "splitter.classification.llm", description = "Time for LLM heading classification")
  public List<ClassificationResult> classifyAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }

    ClassificationResult[] results = new ClassificationResult[texts.size()];
    List<Integer> pending = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      ClassificationResult cached =
          cache != null ? cache.getIfPresent(cacheKey(texts.get(i))) : null;
      if (cached != null) {
        results[i] = cached;
      } else {
        pending.add(i);
      }
    }

    int cacheHits = texts.size() - pending.size();
    if (cacheHits > 0) {
      meterRegistry.counter("splitter.classification.llm.cache_hits").increment(cacheHits);
    }
    log.debug(
        "Classifying {} fragments with LLM ({} served from cache)", texts.size(), cacheHits);

    for (List<Integer> batch : planBatches(texts, pending)) {
      List<String> batchTexts = batch.stream().map(texts::get).toList();
      List<ClassificationResult> batchResults = classifyBatch(batchTexts);
      for (int j = 0; j < batch.size(); j++) {
        results[batch.get(j)] = batchResults.get(j);
      }
    }

    return Arrays.asList(results);
  }

  /**
   * Groups pending fragment indices into batches. A batch is closed when it reaches the batch
   * size or when adding the next fragment would exceed the token budget; a single fragment above
   * the budget still forms its own batch.
   */
  @VisibleForTesting
  List<List<Integer>> planBatches(List<String> texts, List<Integer> pending) {
    List<List<Integer>> batches = new ArrayList<>();
    List<Integer> current = new ArrayList<>();
    int currentTokens = 0;

    for (Integer index : pending) {
      int tokens = estimateTokens(texts.get(index));
      boolean full =
          current.size() >= batchSize || currentTokens + tokens > maxTokensPerBatch;
      if (!current.isEmpty() && full) {
        batches.add(current);
        current = new ArrayList<>();
        currentTokens = 0;
      }
      current.add(index);
      currentTokens += tokens;
    }
    if (!current.isEmpty()) {
      batches.add(current);
    }
    return batches;
  }

  private List<ClassificationResult> classifyBatch(List<String> batchTexts) {
    try {
      Callable<List<ClassificationResult>> attempt =
          Retry.decorateCallable(retry, () -> requestBatch(batchTexts));
      Callable<List<ClassificationResult>> bounded =
          TimeLimiter.decorateFutureSupplier(timeLimiter, () -> executor.submit(attempt));
      List<ClassificationResult> results =
          CircuitBreaker.decorateCallable(circuitBreaker, bounded).call();

      meterRegistry.counter("splitter.classification.llm.batches").increment();
      if (cache != null) {
        for (int i = 0; i < batchTexts.size(); i++) {
          cache.put(cacheKey(batchTexts.get(i)), results.get(i));
        }
      }
      return results;
    } catch (Exception e) {
      String reason = e instanceof TimeoutException ? "timed out" : e.getMessage();
      log.warn(
          "LLM classification of {} fragments failed: {}, using rule-based fallback",
          batchTexts.size(),
          reason);
      meterRegistry.counter("splitter.classification.llm.fallbacks").increment();
      return fallback.classifyAll(batchTexts);
    }
  }

  private List<ClassificationResult> requestBatch(List<String> batchTexts) {
    HeadingClassifications response =
        agent.classify(batchTexts.size(), formatFragments(batchTexts));
    if (response == null || response.results() == null) {
      throw new LlmServiceException("Heading classification returned no results");
    }
    List<HeadingVerdict> verdicts = response.results();
    if (verdicts.size() != batchTexts.size()) {
      throw new LlmServiceException(
          "Heading classification returned "
              + verdicts.size()
              + " results for "
              + batchTexts.size()
              + " fragments");
    }
    return verdicts.stream().map(LlmHeadingClassifier::toResult).toList();
  }

  private static ClassificationResult toResult(HeadingVerdict verdict) {
    if (!verdict.isHeading()) {
      return new ClassificationResult(false, HeadingLevel.DEFAULT_LEVEL, verdict.confidence());
    }
    return new ClassificationResult(
        true, HeadingLevel.clamp(verdict.level()), verdict.confidence());
  }

  private static String formatFragments(List<String> batchTexts) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < batchTexts.size(); i++) {
      String text = batchTexts.get(i) == null ? "" : batchTexts.get(i).strip();
      if (text.length() > MAX_FRAGMENT_CHARS) {
        text = text.substring(0, MAX_FRAGMENT_CHARS) + "...";
      }
      sb.append("[").append(i).append("] ").append(text).append("\n");
    }
    return sb.toString();
  }

  /** Rough token estimate: one per character plus half a token per whitespace-separated word. */
  @VisibleForTesting
  static int estimateTokens(String text) {
    if (text == null || text.isBlank()) {
      return 1;
    }
    String stripped = text.strip();
    int words = stripped.split("\\s+").length;
    return stripped.length() + words / 2;
  }

  private static String cacheKey(String text) {
    return Hashing.sha256().hashString(text == null ? "" : text, StandardCharsets.UTF_8).toString();
  }
}
