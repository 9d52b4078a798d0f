/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import scytale.base.TextFilter;
import scytale.crypt.key.CipherKey;

/**
 * A block-structured cipher that works on a canonical, filtered form of its input and may pad
 * that form with {@link TextFilter#PAD_CHAR} to fill the last block.
 * <p>
 * {@link #decrypt(String, CipherKey)} returns the padded plaintext, since the pad count is not
 * recoverable from the ciphertext. Callers that kept the {@link CipherResult} of {@link
 * #encryptWithPadding(String, CipherKey)} get the exact canonical plaintext back from {@link
 * #decrypt(CipherResult, CipherKey)}.
 * </p>
 *
 * @param <K> the key variant this cipher accepts
 */
public interface PaddingCipher<K extends CipherKey> extends Cipher<K> {

    /**
     * Returns the canonical form of {@code text} this cipher encrypts: upper case, with the
     * characters the cipher ignores removed.
     *
     * @param text the input text
     *
     * @return the canonical text, before padding
     */
    String canonicalize(String text);

    /**
     * Encrypts {@code text} and records how much padding was added.
     *
     * @param text the plaintext
     * @param key  the key
     *
     * @return the ciphertext and pad count
     */
    default CipherResult encryptWithPadding(String text, K key) {
        String ciphertext = encrypt(text, key);
        return new CipherResult(ciphertext, ciphertext.length() - canonicalize(text).length());
    }

    /**
     * Decrypts a result of {@link #encryptWithPadding(String, CipherKey)} and strips the recorded
     * padding.
     *
     * @param result the ciphertext and pad count
     * @param key    the key used for encryption
     *
     * @return the canonical plaintext
     *
     * @throws InvalidCipherParameterException if the recorded padding is longer than the
     *                                         decrypted text
     */
    default String decrypt(CipherResult result, K key) {
        String padded = decrypt(result.text(), key);
        if (result.padding() > padded.length()) {
            throw new InvalidCipherParameterException(
                "Result records padding " + result.padding() + " but decrypts to only " +
                padded.length() + " characters");
        }
        return TextFilter.stripPadding(padded, result.padding());
    }
}
