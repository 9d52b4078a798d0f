package scytale.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.base.Alphabet;

/**
 * Finds letter sequences that occur more than once in a text, the starting point of a Kasiski
 * examination of a polyalphabetic ciphertext.
 */
public final class RepeatedSequences {
  private static final Logger logger = LoggerFactory.getLogger(RepeatedSequences.class);

  public static final int DEFAULT_MIN_LENGTH = 3;
  public static final int DEFAULT_MAX_LENGTH = 10;

  private RepeatedSequences() {}

  /**
   * Finds repeated sequences of {@value #DEFAULT_MIN_LENGTH} to {@value #DEFAULT_MAX_LENGTH}
   * letters.
   *
   * @param text the text to search
   * @return see {@link #find(String, int, int)}
   */
  public static Map<String, List<Integer>> find(String text) {
    return find(text, DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
  }

  /**
   * Finds every sequence of {@code minLength} to {@code maxLength} consecutive letters that
   * occurs at least twice in {@code text}. Matching ignores case; a window containing any
   * character outside the alphabet is skipped. Occurrences may overlap.
   *
   * @param text the text to search
   * @param minLength the shortest sequence length, at least 1
   * @param maxLength the longest sequence length, at least {@code minLength}
   * @return a map from each repeated upper case sequence to its starting offsets in ascending
   *     order; sequences are ordered by length, then by first occurrence
   * @throws AnalysisDomainException if the length bounds are invalid
   */
  public static Map<String, List<Integer>> find(String text, int minLength, int maxLength) {
    if (minLength < 1 || maxLength < minLength) {
      logger.debug("Rejecting sequence length bounds {}..{}", minLength, maxLength);
      throw new AnalysisDomainException(
          "Sequence lengths must satisfy 1 <= min <= max, got " + minLength + ".." + maxLength);
    }
    String upper = text.toUpperCase(Locale.ROOT);
    Map<String, List<Integer>> repeated = new LinkedHashMap<>();
    for (int length = minLength; length <= maxLength; length++) {
      Map<String, List<Integer>> positions = new LinkedHashMap<>();
      for (int i = 0; i + length <= upper.length(); i++) {
        String seq = upper.substring(i, i + length);
        if (Alphabet.isAlphabetic(seq)) {
          positions.computeIfAbsent(seq, s -> new ArrayList<>()).add(i);
        }
      }
      for (Map.Entry<String, List<Integer>> e : positions.entrySet()) {
        if (e.getValue().size() > 1) {
          repeated.put(e.getKey(), List.copyOf(e.getValue()));
        }
      }
    }
    return repeated;
  }

  /**
   * Returns, for every repeated sequence, the distances between its successive occurrences.
   * In a polyalphabetic ciphertext these distances tend to be multiples of the key length.
   *
   * @param text the text to search
   * @param minLength the shortest sequence length, at least 1
   * @param maxLength the longest sequence length, at least {@code minLength}
   * @return a map, in the order of {@link #find(String, int, int)}, from sequence to the
   *     differences between consecutive starting offsets
   * @throws AnalysisDomainException if the length bounds are invalid
   */
  public static Map<String, List<Integer>> spacings(String text, int minLength, int maxLength) {
    Map<String, List<Integer>> spacings = new LinkedHashMap<>();
    for (Map.Entry<String, List<Integer>> e : find(text, minLength, maxLength).entrySet()) {
      List<Integer> positions = e.getValue();
      List<Integer> gaps = new ArrayList<>(positions.size() - 1);
      for (int i = 1; i < positions.size(); i++) {
        gaps.add(positions.get(i) - positions.get(i - 1));
      }
      spacings.put(e.getKey(), List.copyOf(gaps));
    }
    return spacings;
  }
}
