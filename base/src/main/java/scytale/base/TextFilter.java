package scytale.base;

import org.apache.commons.lang3.StringUtils;

/**
 * Produces the canonical forms of text that the block-structured ciphers operate on, and pads them
 * to a whole number of blocks.
 *
 * <p>Canonical text is always upper case. Digits count as alphanumeric but are not letters of the
 * {@link Alphabet}.
 */
public final class TextFilter {

  /** The character appended to fill an incomplete final block. */
  public static final char PAD_CHAR = 'X';

  /** Private constructor to prevent instantiation of this utility class. */
  private TextFilter() {}

  /**
   * Keeps only the letters of {@code text}, upper cased.
   *
   * @param text the text to filter
   * @return the letters of {@code text} in order, upper case
   */
  public static String lettersOnly(CharSequence text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Alphabet.isLetter(c)) {
        sb.append(Character.toUpperCase(c));
      }
    }
    return sb.toString();
  }

  /**
   * Keeps only the letters and ASCII digits of {@code text}, with letters upper cased. Spaces and
   * punctuation are dropped.
   *
   * @param text the text to filter
   * @return the alphanumeric characters of {@code text} in order
   */
  public static String alphanumericOnly(CharSequence text) {
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Alphabet.isLetter(c)) {
        sb.append(Character.toUpperCase(c));
      } else if (c >= '0' && c <= '9') {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /**
   * Returns the number of pad characters needed to bring {@code length} up to a multiple of {@code
   * blockSize}.
   *
   * @param length the unpadded length
   * @param blockSize the block size, must be positive
   * @return a value in {@code [0, blockSize)}
   * @throws IllegalArgumentException if {@code blockSize} is not positive
   */
  public static int paddingFor(int length, int blockSize) {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("Block size must be positive: " + blockSize);
    }
    return Math.floorMod(blockSize - length % blockSize, blockSize);
  }

  /**
   * Appends {@link #PAD_CHAR} to {@code text} until its length is a multiple of {@code blockSize}.
   *
   * @param text the text to pad
   * @param blockSize the block size, must be positive
   * @return the padded text; {@code text} itself if no padding was needed
   */
  public static String pad(String text, int blockSize) {
    return StringUtils.rightPad(text, text.length() + paddingFor(text.length(), blockSize), PAD_CHAR);
  }

  /**
   * Removes {@code padding} trailing characters from {@code text}.
   *
   * @param text the padded text
   * @param padding the number of characters to strip
   * @return {@code text} without its last {@code padding} characters
   * @throws IllegalArgumentException if {@code padding} is negative or longer than the text
   */
  public static String stripPadding(String text, int padding) {
    if (padding < 0 || padding > text.length()) {
      throw new IllegalArgumentException(
          String.format("Cannot strip %d characters from text of length %d", padding, text.length()));
    }
    return text.substring(0, text.length() - padding);
  }
}
