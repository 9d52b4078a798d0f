package scytale.crypt.key;

import java.util.Locale;
import java.util.Objects;

/**
 * A keyword, used by the Vigenère, Beaufort and Autokey ciphers and as the column key of the
 * Myszkowski transposition. Case is not significant.
 *
 * @param keyword the keyword as given
 */
public record KeywordKey(String keyword) implements CipherKey {
  public KeywordKey {
    Objects.requireNonNull(keyword, "keyword");
  }

  /**
   * Returns the keyword in upper case, the form every cipher works with.
   *
   * @return the upper case keyword
   */
  public String normalized() {
    return keyword.toUpperCase(Locale.ROOT);
  }
}
