/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.keystream;

import scytale.base.Alphabet;

/**
 * Yields {@code shift, shift + 1, shift + 2, ...} modulo 26, one value per letter: the key
 * schedule of the August cipher.
 */
public final class ProgressiveKeyStream implements KeyStream {

    /**
     * Creates a stream starting at {@code initialShift}.
     *
     * @param initialShift the first value, reduced modulo 26
     */
    public ProgressiveKeyStream(int initialShift) {
        current = Math.floorMod(initialShift, Alphabet.SIZE);
    }

    @Override
    public int next() {
        int residue = current;
        current = (current + 1) % Alphabet.SIZE;
        return residue;
    }

    private int current;
}
