/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.keystream;

import scytale.base.Alphabet;

/**
 * The self-extending key of the Autokey cipher: the priming key followed by the plaintext.
 * <p>
 * Unlike a {@link KeyStream} this key is positional. Every character of the text, letter or
 * not, consumes one key position, and position {@code i} is the priming key's character
 * {@code i} while {@code i} is within the priming key, otherwise the plaintext character at
 * {@code i - primer length}. A key character that is not a letter contributes a shift of 0.
 * </p>
 * <p>
 * For encryption the plaintext source is the input. For decryption it is the output being
 * built, which always holds the character needed because the key for position {@code i} only
 * refers to positions before {@code i}.
 * </p>
 */
public final class AutokeyStream {

    /**
     * Creates a key over a priming key and a plaintext source.
     *
     * @param primingKey the priming key
     * @param plaintext  the plaintext, or the buffer it is being decrypted into
     */
    public AutokeyStream(String primingKey, CharSequence plaintext) {
        this.primingKey = primingKey;
        this.plaintext = plaintext;
    }

    /**
     * Returns the key residue at {@code position}.
     *
     * @param position the index of the text character being processed
     *
     * @return a residue in {@code [0, 26)}
     *
     * @throws IndexOutOfBoundsException if the plaintext source does not yet reach the needed
     *                                   position
     */
    public int keyAt(int position) {
        char c = position < primingKey.length()
                 ? primingKey.charAt(position)
                 : plaintext.charAt(position - primingKey.length());
        return Alphabet.isLetter(c) ? Alphabet.residue(c) : 0;
    }

    private final String primingKey;
    private final CharSequence plaintext;
}
