/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import scytale.base.Alphabet;
import scytale.base.TextSymbol;
import scytale.crypt.Cipher;
import scytale.crypt.CipherType;
import scytale.crypt.key.CipherKey;

import java.util.function.IntUnaryOperator;

/**
 * Base class for ciphers that replace each letter independently of the others' positions.
 * <p>
 * Subclasses supply, for a key, the residue transform applied to each letter in turn. The
 * transform is created afresh for every call, so any key stream it draws on is local to that
 * call. Characters outside the alphabet are copied unchanged and are never passed to the
 * transform, and every letter keeps its original case.
 * </p>
 *
 * @param <K> the key variant
 */
public abstract class AbstractSubstitutionCipher<K extends CipherKey> implements Cipher<K> {

    protected AbstractSubstitutionCipher(CipherType type) {
        this.type = type;
    }

    @Override
    public final CipherType getType() {
        return type;
    }

    @Override
    public String encrypt(String text, K key) {
        validateKey(key);
        return substitute(text, encryption(key));
    }

    @Override
    public String decrypt(String text, K key) {
        validateKey(key);
        return substitute(text, decryption(key));
    }

    /**
     * Checks that {@code key} is usable. The default accepts every key.
     *
     * @param key the key
     *
     * @throws scytale.crypt.InvalidCipherKeyException if it is not
     */
    protected void validateKey(K key) {
    }

    /**
     * Returns the transform applied to successive plaintext residues. The result need not be
     * reduced modulo 26.
     *
     * @param key a validated key
     *
     * @return a transform for one encryption
     */
    protected abstract IntUnaryOperator encryption(K key);

    /**
     * Returns the transform applied to successive ciphertext residues. The result need not be
     * reduced modulo 26.
     *
     * @param key a validated key
     *
     * @return a transform for one decryption
     */
    protected abstract IntUnaryOperator decryption(K key);

    /**
     * Applies {@code transform} to every letter of {@code text}, in order.
     *
     * @param text      the input
     * @param transform the residue transform
     *
     * @return the transformed text, of the same length as {@code text}
     */
    protected static String substitute(CharSequence text, IntUnaryOperator transform) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            TextSymbol symbol = Alphabet.classify(text.charAt(i));
            if (symbol instanceof TextSymbol.Letter letter) {
                sb.append(letter.withResidue(transform.applyAsInt(letter.residue())).toChar());
            } else {
                sb.append(symbol.toChar());
            }
        }
        return sb.toString();
    }

    private final CipherType type;
}
