/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.keystream;

import scytale.base.Alphabet;

/**
 * A sequence of key residues consumed one per letter of the text, in step with the text.
 * Characters outside the alphabet do not consume a value.
 * <p>
 * A key stream is stateful and belongs to a single encryption or decryption call; ciphers
 * create a fresh one for every call.
 * </p>
 */
public interface KeyStream {

    /**
     * Returns the key residue for the next letter and advances the stream.
     *
     * @return a residue in {@code [0, 26)}
     */
    int next();

    /**
     * Returns a stream that yields the same residue forever: the Caesar case.
     *
     * @param shift the shift, reduced modulo 26
     *
     * @return the constant stream
     */
    static KeyStream constant(int shift) {
        int residue = Math.floorMod(shift, Alphabet.SIZE);
        return () -> residue;
    }
}
