package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drops near-duplicate chunks, keeping the first occurrence.
 *
 * <p>Chunks are compared by fingerprint: the text with chunk decorations removed, whitespace
 * collapsed, lower-cased and cut to {@value #FINGERPRINT_LENGTH} characters. Two fingerprints are
 * near-duplicates when the Jaccard similarity of their character sets reaches the threshold. The
 * match ignores character order; it targets headers and boilerplate repeated across table chunks.
 */
@Service
@Slf4j
public class ChunkDeduplicator {

  public static final double DEFAULT_THRESHOLD = 0.7;
  static final int FINGERPRINT_LENGTH = 300;

  private static final List<Pattern> DECORATIONS =
      List.of(
          Pattern.compile("【Chunk\\s*\\d+】[^\\n]*\\n?"),
          Pattern.compile("\\[Chunk\\s*\\d+][^\\n]*\\n?", Pattern.CASE_INSENSITIVE),
          Pattern.compile("={50,}"),
          Pattern.compile("-{20,}"),
          Pattern.compile("[(（]长度[:：]\\s*\\d+\\s*字符[)）]"),
          Pattern.compile("\\(length:\\s*\\d+\\s*chars?\\)", Pattern.CASE_INSENSITIVE));
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public List<String> dedup(List<String> chunks) {
    return dedup(chunks, DEFAULT_THRESHOLD);
  }

  public List<String> dedup(List<String> chunks, double threshold) {
    validateThreshold(threshold);
    List<String> kept = new ArrayList<>();
    List<Set<Integer>> seen = new ArrayList<>();

    for (String chunk : chunks) {
      Set<Integer> chars = characterSet(fingerprint(chunk));
      boolean duplicate =
          !chars.isEmpty() && seen.stream().anyMatch(prior -> jaccard(prior, chars) >= threshold);
      if (duplicate) {
        continue;
      }
      kept.add(chunk);
      seen.add(chars);
    }

    int removed = chunks.size() - kept.size();
    if (removed > 0) {
      log.debug("Removed {} near-duplicate chunks of {}", removed, chunks.size());
    }
    return kept;
  }

  static String fingerprint(String chunk) {
    if (chunk == null) {
      return "";
    }
    String text = chunk;
    for (Pattern decoration : DECORATIONS) {
      text = decoration.matcher(text).replaceAll(" ");
    }
    text = WHITESPACE.matcher(text).replaceAll(" ").strip().toLowerCase(Locale.ROOT);
    if (text.codePointCount(0, text.length()) > FINGERPRINT_LENGTH) {
      text = text.substring(0, text.offsetByCodePoints(0, FINGERPRINT_LENGTH));
    }
    return text;
  }

  static double jaccard(Set<Integer> a, Set<Integer> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 0.0;
    }
    Set<Integer> union = new HashSet<>(a);
    union.addAll(b);
    long intersection = a.stream().filter(b::contains).count();
    return (double) intersection / union.size();
  }

  static void validateThreshold(double threshold) {
    if (!(threshold > 0.0 && threshold <= 1.0)) {
      throw new ChunkingConfigurationException(
          "dedup threshold",
          threshold,
          "Dedup threshold must be in (0, 1], got " + threshold);
    }
  }

  private static Set<Integer> characterSet(String fingerprint) {
    return fingerprint.codePoints().boxed().collect(Collectors.toSet());
  }
}
