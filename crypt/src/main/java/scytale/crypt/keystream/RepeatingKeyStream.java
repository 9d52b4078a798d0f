/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.keystream;

import scytale.base.Alphabet;
import scytale.crypt.InvalidCipherKeyException;

/**
 * Cycles through the letters of a keyword, as used by the Vigenère and Beaufort ciphers.
 */
public final class RepeatingKeyStream implements KeyStream {

    /**
     * Creates a stream over {@code keyword}.
     *
     * @param keyword the keyword; case is ignored
     *
     * @throws InvalidCipherKeyException if the keyword is empty or contains a non-letter
     */
    public RepeatingKeyStream(String keyword) {
        if (!Alphabet.isAlphabetic(keyword)) {
            throw new InvalidCipherKeyException(
                "Keyword must be a non-empty string of letters: \"" + keyword + "\"");
        }
        residues = new int[keyword.length()];
        for (int i = 0; i < residues.length; i++) {
            residues[i] = Alphabet.residue(keyword.charAt(i));
        }
    }

    @Override
    public int next() {
        int residue = residues[index];
        index = (index + 1) % residues.length;
        return residue;
    }

    private final int[] residues;
    private int index;
}
