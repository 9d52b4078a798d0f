package scytale.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts n-grams from text and computes their relative frequencies.
 *
 * <p>Character n-grams are taken over the whole upper cased text, spaces and punctuation
 * included. Word n-grams are taken over the lower cased words of the text, joined by a single
 * space; a word is a maximal run of letters, digits and underscores.
 */
public final class NgramAnalysis {
  private static final Logger logger = LoggerFactory.getLogger(NgramAnalysis.class);

  private static final Pattern WORD =
      Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

  /** The n-gram size used by {@link #frequencyAnalysis(String)}. */
  public static final int DEFAULT_N = 1;

  private NgramAnalysis() {}

  /**
   * Returns the character n-grams of {@code text}.
   *
   * @param text the text to analyse
   * @param n the n-gram size, at least 1
   * @return every window of {@code n} characters, in order
   * @throws AnalysisDomainException if {@code n < 1}
   */
  public static List<String> ngrams(String text, int n) {
    return ngrams(text, n, false);
  }

  /**
   * Returns the n-grams of {@code text}.
   *
   * @param text the text to analyse
   * @param n the n-gram size, at least 1
   * @param asWord whether to take n-grams of words instead of characters
   * @return the n-grams in order of position; empty if the text is shorter than {@code n}
   * @throws AnalysisDomainException if {@code n < 1}
   */
  public static List<String> ngrams(String text, int n, boolean asWord) {
    if (n < 1) {
      logger.debug("Rejecting n-gram size {}", n);
      throw new AnalysisDomainException("n must be at least 1, got " + n);
    }
    return asWord ? wordNgrams(text, n) : charNgrams(text, n);
  }

  /**
   * Returns the relative frequency of each single character of {@code text}.
   *
   * @param text the text to analyse
   * @return see {@link #frequencyAnalysis(String, int, boolean)}
   */
  public static Map<String, Double> frequencyAnalysis(String text) {
    return frequencyAnalysis(text, DEFAULT_N, false);
  }

  /**
   * Returns the relative frequency of each distinct n-gram of {@code text}, as a percentage of
   * all n-grams.
   *
   * @param text the text to analyse
   * @param n the n-gram size, at least 1
   * @param asWord whether to take n-grams of words instead of characters
   * @return an insertion-ordered map from n-gram to percentage, by descending count and, among
   *     equal counts, by first occurrence; empty if the text has no n-gram
   * @throws AnalysisDomainException if {@code n < 1}
   */
  public static Map<String, Double> frequencyAnalysis(String text, int n, boolean asWord) {
    List<String> grams = ngrams(text, n, asWord);
    if (grams.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String gram : grams) {
      counts.merge(gram, 1, Integer::sum);
    }
    List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
    // List.sort is stable, so ties keep first-occurrence order
    sorted.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

    int total = grams.size();
    Map<String, Double> frequencies = new LinkedHashMap<>();
    for (Map.Entry<String, Integer> e : sorted) {
      frequencies.put(e.getKey(), (double) e.getValue() / total * 100);
    }
    logger.trace("{} distinct {}-grams out of {}", frequencies.size(), n, total);
    return frequencies;
  }

  private static List<String> charNgrams(String text, int n) {
    String upper = text.toUpperCase(Locale.ROOT);
    if (upper.length() < n) {
      return List.of();
    }
    List<String> out = new ArrayList<>(upper.length() - n + 1);
    for (int i = 0; i + n <= upper.length(); i++) {
      out.add(upper.substring(i, i + n));
    }
    return out;
  }

  private static List<String> wordNgrams(String text, int n) {
    List<String> words = new ArrayList<>();
    Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (m.find()) {
      words.add(m.group());
    }
    if (words.size() < n) {
      return List.of();
    }
    List<String> out = new ArrayList<>(words.size() - n + 1);
    for (int i = 0; i + n <= words.size(); i++) {
      out.add(String.join(" ", words.subList(i, i + n)));
    }
    return out;
  }
}
