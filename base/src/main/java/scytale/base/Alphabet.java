package scytale.base;

/**
 * Maps characters of the 26-letter Latin alphabet to their residues ({@code A}/{@code a} = 0 ...
 * {@code Z}/{@code z} = 25) and back.
 *
 * <p>Only the ASCII letters belong to the alphabet. Every other character, including accented and
 * non-Latin letters, digits and punctuation, is classified as {@link TextSymbol.Other}. All methods
 * are total: no character is rejected.
 */
public final class Alphabet {

  /** The number of letters in the alphabet, and the modulus of every residue computation. */
  public static final int SIZE = 26;

  /** Private constructor to prevent instantiation of this utility class. */
  private Alphabet() {}

  /**
   * Classifies a character.
   *
   * @param c the character to classify
   * @return a {@link TextSymbol.Letter} for {@code A-Z} and {@code a-z}, otherwise a {@link
   *     TextSymbol.Other} wrapping {@code c}
   */
  public static TextSymbol classify(char c) {
    if (c >= 'A' && c <= 'Z') {
      return new TextSymbol.Letter(c - 'A', true);
    }
    if (c >= 'a' && c <= 'z') {
      return new TextSymbol.Letter(c - 'a', false);
    }
    return new TextSymbol.Other(c);
  }

  /**
   * Returns whether {@code c} is a letter of the alphabet, in either case.
   *
   * @param c the character to test
   * @return {@code true} for {@code A-Z} and {@code a-z}
   */
  public static boolean isLetter(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }

  /**
   * Returns the residue of a letter regardless of its case.
   *
   * @param c the letter
   * @return the residue, {@code 0..25}
   * @throws IllegalArgumentException if {@code c} is not a letter of the alphabet
   */
  public static int residue(char c) {
    if (c >= 'A' && c <= 'Z') {
      return c - 'A';
    }
    if (c >= 'a' && c <= 'z') {
      return c - 'a';
    }
    throw new IllegalArgumentException("Not a letter of the alphabet: '" + c + "'");
  }

  /**
   * Converts a residue back to a letter.
   *
   * @param residue the residue; any integer is accepted and reduced modulo {@link #SIZE}
   * @param upperCase whether to return the upper case form
   * @return the letter
   */
  public static char fromResidue(int residue, boolean upperCase) {
    int r = Math.floorMod(residue, SIZE);
    return (char) ((upperCase ? 'A' : 'a') + r);
  }

  /**
   * Returns whether {@code s} is non-empty and made only of letters of the alphabet.
   *
   * @param s the string to test
   * @return {@code true} if every character of {@code s} is a letter
   */
  public static boolean isAlphabetic(CharSequence s) {
    if (s.length() == 0) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (!isLetter(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
