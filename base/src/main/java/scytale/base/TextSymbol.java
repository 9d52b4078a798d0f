package scytale.base;

/**
 * A single character of input text as seen by the ciphers: either a {@link Letter} of the 26-letter
 * Latin alphabet, carrying its residue and case, or any {@link Other} character, which is passed
 * through unchanged.
 *
 * @see Alphabet#classify(char)
 */
public interface TextSymbol {

  /**
   * Returns this symbol rendered back as a character.
   *
   * @return the character this symbol stands for
   */
  char toChar();

  /**
   * An alphabetic character.
   *
   * @param residue the position of the letter in the alphabet, {@code 0..25}
   * @param upperCase whether the original character was upper case
   */
  record Letter(int residue, boolean upperCase) implements TextSymbol {
    public Letter {
      if (residue < 0 || residue >= Alphabet.SIZE) {
        throw new IllegalArgumentException("Residue out of range: " + residue);
      }
    }

    @Override
    public char toChar() {
      return Alphabet.fromResidue(residue, upperCase);
    }

    /**
     * Returns a letter with the given residue and the same case as this one.
     *
     * @param newResidue the residue of the new letter, reduced modulo {@link Alphabet#SIZE}
     * @return the recased letter
     */
    public Letter withResidue(int newResidue) {
      return new Letter(Math.floorMod(newResidue, Alphabet.SIZE), upperCase);
    }
  }

  /**
   * Any character outside the alphabet.
   *
   * @param value the original character
   */
  record Other(char value) implements TextSymbol {
    @Override
    public char toChar() {
      return value;
    }
  }
}
