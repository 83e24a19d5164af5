package com.flamingo.ai.contractsplitter.service.chunking;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import com.flamingo.ai.contractsplitter.model.ChunkingWarning;
import com.flamingo.ai.contractsplitter.service.chunking.SentenceSegmenter.Span;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits text that exceeds a maximum size into overlapping pieces.
 *
 * <p>In sentence mode, sentences are accumulated greedily until the next one would overflow. The
 * following piece starts with an overlap made of the whole trailing sentences that fit in the
 * overlap budget; when not even the last sentence fits, a raw tail is used instead and a {@link
 * ChunkingWarning.Type#RAW_OVERLAP} warning is recorded. A sentence that alone exceeds the maximum
 * is emitted unmodified with an {@link ChunkingWarning.Type#OVERSIZED_SENTENCE} warning, so the
 * size bound holds for every piece except such single sentences.
 *
 * <p>In raw mode, the text is cut into windows of at most {@code maxSize} units, each starting
 * {@code overlap} units before the end of the previous one.
 *
 * <p>Text that already fits is returned as is, whatever the overlap. An overlap of {@code maxSize}
 * or more is capped at {@code maxSize - 1} and every window still advances by at least one code
 * point.
 *
 * <p>Every piece is a contiguous substring of the input.
 */
@Service
@Slf4j
public class SizeConstrainedSplitter {

  public SplitResult split(String text, int maxSize, int overlap) {
    return split(text, maxSize, overlap, true, SizeFunction.characters());
  }

  public SplitResult split(
      String text, int maxSize, int overlap, boolean bySentence, SizeFunction sizeFunction) {
    validate(maxSize, overlap);
    if (text == null || text.isEmpty()) {
      return SplitResult.empty();
    }
    if (sizeFunction.measure(text) <= maxSize) {
      return SplitResult.of(text);
    }
    // The overlap is a proper suffix of a piece, so it never needs maxSize units
    int effectiveOverlap = Math.min(overlap, maxSize - 1);
    return bySentence
        ? splitBySentence(text, maxSize, effectiveOverlap, sizeFunction)
        : splitRaw(text, maxSize, effectiveOverlap, sizeFunction);
  }

  static void validate(int maxSize, int overlap) {
    if (maxSize <= 0) {
      throw new ChunkingConfigurationException(
          "max size", maxSize, "Max size must be positive, got " + maxSize);
    }
    if (overlap < 0) {
      throw new ChunkingConfigurationException(
          "overlap", overlap, "Overlap must not be negative, got " + overlap);
    }
  }

  // ---- sentence mode ----

  private SplitResult splitBySentence(
      String text, int maxSize, int overlap, SizeFunction sizeFunction) {
    List<Span> sentences = SentenceSegmenter.segment(text);
    List<String> pieces = new ArrayList<>();
    List<ChunkingWarning> warnings = new ArrayList<>();

    if (sentences.size() <= 1) {
      oversized(text, maxSize, sizeFunction, warnings);
      return new SplitResult(List.of(text), warnings);
    }

    // Open piece is text[pieceStart, pieceEnd); pieceStart < 0 means no piece is open.
    int pieceStart = -1;
    int pieceEnd = -1;

    for (int k = 0; k < sentences.size(); k++) {
      Span sentence = sentences.get(k);

      if (pieceStart >= 0 && fits(text, pieceStart, sentence.end(), maxSize, sizeFunction)) {
        pieceEnd = sentence.end();
        continue;
      }
      if (pieceStart < 0 && fits(text, sentence.start(), sentence.end(), maxSize, sizeFunction)) {
        pieceStart = sentence.start();
        pieceEnd = sentence.end();
        continue;
      }

      int overlapStart = -1;
      if (pieceStart >= 0) {
        pieces.add(text.substring(pieceStart, pieceEnd).strip());
        overlapStart =
            overlapStart(text, sentences, k, pieceStart, pieceEnd, overlap, sizeFunction, warnings);
      }

      if (overlapStart >= 0 && fits(text, overlapStart, sentence.end(), maxSize, sizeFunction)) {
        pieceStart = overlapStart;
        pieceEnd = sentence.end();
      } else if (fits(text, sentence.start(), sentence.end(), maxSize, sizeFunction)) {
        pieceStart = sentence.start();
        pieceEnd = sentence.end();
      } else {
        String single = text.substring(sentence.start(), sentence.end());
        oversized(single, maxSize, sizeFunction, warnings);
        pieces.add(single);
        pieceStart = -1;
        pieceEnd = -1;
      }
    }

    if (pieceStart >= 0) {
      pieces.add(text.substring(pieceStart, pieceEnd).strip());
    }
    return new SplitResult(pieces, warnings);
  }

  /**
   * Start of the overlap carried from the piece {@code [pieceStart, pieceEnd)} into the next one,
   * or {@code -1} for none. The overlap is always a proper suffix of the piece.
   */
  private int overlapStart(
      String text,
      List<Span> sentences,
      int nextSentence,
      int pieceStart,
      int pieceEnd,
      int overlap,
      SizeFunction sizeFunction,
      List<ChunkingWarning> warnings) {
    if (overlap == 0) {
      return -1;
    }

    int start = -1;
    for (int j = nextSentence - 1; j >= 0; j--) {
      int candidate = sentences.get(j).start();
      if (candidate <= pieceStart || !fits(text, candidate, pieceEnd, overlap, sizeFunction)) {
        break;
      }
      start = candidate;
    }
    if (start >= 0) {
      return start;
    }

    int raw = smallestFittingStart(text, pieceStart + 1, pieceEnd, overlap, sizeFunction);
    while (raw < pieceEnd && Character.isWhitespace(text.charAt(raw))) {
      raw++;
    }
    if (raw >= pieceEnd) {
      return -1;
    }
    warnings.add(
        ChunkingWarning.of(
            ChunkingWarning.Type.RAW_OVERLAP,
            "No sentence boundary fits in an overlap of " + overlap + ", carried a raw tail",
            text.substring(raw, pieceEnd)));
    return raw;
  }

  private void oversized(
      String sentence, int maxSize, SizeFunction sizeFunction, List<ChunkingWarning> warnings) {
    int size = sizeFunction.measure(sentence);
    log.warn("Sentence of size {} exceeds max size {}, emitting it unsplit", size, maxSize);
    warnings.add(
        ChunkingWarning.of(
            ChunkingWarning.Type.OVERSIZED_SENTENCE,
            "Sentence of size " + size + " exceeds max size " + maxSize,
            sentence));
  }

  // ---- raw mode ----

  private SplitResult splitRaw(String text, int maxSize, int overlap, SizeFunction sizeFunction) {
    List<String> pieces = new ArrayList<>();
    int start = 0;

    while (start < text.length()) {
      int end = largestFittingEnd(text, start, maxSize, sizeFunction);
      pieces.add(text.substring(start, end));
      if (end >= text.length()) {
        break;
      }
      int next =
          overlap == 0 ? end : smallestFittingStart(text, start + 1, end, overlap, sizeFunction);
      start = Math.max(next, start + 1);
      if (Character.isLowSurrogate(text.charAt(start))) {
        start++;
      }
    }
    return new SplitResult(pieces, List.of());
  }

  /** Largest {@code end} such that {@code text[start, end)} fits; at least one code point. */
  private static int largestFittingEnd(
      String text, int start, int maxSize, SizeFunction sizeFunction) {
    int lo = start + Character.charCount(text.codePointAt(start));
    int hi = text.length();
    int best = lo;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (sizeFunction.measure(text.substring(start, mid)) <= maxSize) {
        best = mid;
        lo = mid + 1;
      } else {
        hi = mid - 1;
      }
    }
    if (best < text.length() && Character.isLowSurrogate(text.charAt(best))) {
      best--;
    }
    return best;
  }

  /**
   * Smallest {@code start} in {@code [from, end]} such that {@code text[start, end)} fits in {@code
   * budget}, never pointing into the middle of a surrogate pair.
   */
  private static int smallestFittingStart(
      String text, int from, int end, int budget, SizeFunction sizeFunction) {
    int lo = from;
    int hi = end;
    int best = end;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      if (sizeFunction.measure(text.substring(mid, end)) <= budget) {
        best = mid;
        hi = mid - 1;
      } else {
        lo = mid + 1;
      }
    }
    if (best < end && Character.isLowSurrogate(text.charAt(best))) {
      best++;
    }
    return best;
  }

  private static boolean fits(
      String text, int start, int end, int maxSize, SizeFunction sizeFunction) {
    return sizeFunction.measure(text.substring(start, end)) <= maxSize;
  }
}
