/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import scytale.base.Alphabet;
import scytale.crypt.CipherType;
import scytale.crypt.key.EmptyKey;

import java.util.function.IntUnaryOperator;

/**
 * The Atbash cipher: the alphabet reversed, {@code x -> 25 - x}. It is its own inverse.
 */
public final class AtbashCipher extends AbstractSubstitutionCipher<EmptyKey> {
    private static final IntUnaryOperator MIRROR = x -> Alphabet.SIZE - 1 - x;

    public AtbashCipher() {
        super(CipherType.ATBASH);
    }

    /**
     * Encrypts {@code text}; equivalent to {@code encrypt(text, EmptyKey.INSTANCE)}.
     *
     * @param text the plaintext
     *
     * @return the ciphertext
     */
    public String encrypt(String text) {
        return encrypt(text, EmptyKey.INSTANCE);
    }

    /**
     * Decrypts {@code text}; the same function as {@link #encrypt(String)}.
     *
     * @param text the ciphertext
     *
     * @return the plaintext
     */
    public String decrypt(String text) {
        return decrypt(text, EmptyKey.INSTANCE);
    }

    @Override
    protected IntUnaryOperator encryption(EmptyKey key) {
        return MIRROR;
    }

    @Override
    protected IntUnaryOperator decryption(EmptyKey key) {
        return MIRROR;
    }
}
