package scytale.analysis;

import scytale.base.Alphabet;

/**
 * Single-letter statistics over the alphabetic content of a text. Characters outside the
 * alphabet are ignored and case is not significant.
 */
public final class LetterStatistics {

  /** Typical index of coincidence of English plaintext. */
  public static final double ENGLISH_INDEX_OF_COINCIDENCE = 0.0667;

  /** Index of coincidence of uniformly random letters, {@code 1/26}. */
  public static final double RANDOM_INDEX_OF_COINCIDENCE = 1.0 / Alphabet.SIZE;

  private LetterStatistics() {}

  /**
   * Counts each letter of {@code text}.
   *
   * @param text the text to analyse
   * @return an array of {@link Alphabet#SIZE} counts indexed by residue
   */
  public static int[] letterCounts(CharSequence text) {
    int[] counts = new int[Alphabet.SIZE];
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Alphabet.isLetter(c)) {
        counts[Alphabet.residue(c)]++;
      }
    }
    return counts;
  }

  /**
   * Computes the index of coincidence of {@code text}: the probability that two letters drawn
   * without replacement are the same, {@code sum f(f-1) / (N(N-1))} over the letter counts
   * {@code f} of a text of {@code N} letters.
   *
   * @param text the text to analyse
   * @return the index, in {@code [0, 1]}; {@code 0.0} if the text has fewer than two letters
   */
  public static double indexOfCoincidence(CharSequence text) {
    long n = 0;
    long pairs = 0;
    for (int f : letterCounts(text)) {
      n += f;
      pairs += (long) f * (f - 1);
    }
    if (n <= 1) {
      return 0.0;
    }
    return (double) pairs / (n * (n - 1));
  }
}
