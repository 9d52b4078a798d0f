/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import scytale.crypt.key.CipherKey;

/**
 * A classical cipher: a pair of pure functions from text and key to text.
 * <p>
 * Implementations hold no state between calls and may be shared freely between threads. Every
 * failure is reported by throwing a {@link CipherException}; no partial result is returned.
 * </p>
 *
 * @param <K> the key variant this cipher accepts
 * @see Ciphers
 */
public interface Cipher<K extends CipherKey> {

    /**
     * Returns the variant this cipher implements.
     *
     * @return the cipher type
     */
    CipherType getType();

    /**
     * Encrypts {@code text}.
     *
     * @param text the plaintext
     * @param key  the key
     *
     * @return the ciphertext
     *
     * @throws InvalidCipherKeyException       if the key is not usable by this cipher
     * @throws InvalidCipherParameterException if a parameter does not fit the text
     */
    String encrypt(String text, K key);

    /**
     * Decrypts {@code text}.
     *
     * @param text the ciphertext
     * @param key  the key used for encryption
     *
     * @return the plaintext
     *
     * @throws InvalidCipherKeyException       if the key is not usable by this cipher
     * @throws InvalidCipherParameterException if the ciphertext does not have the shape the key
     *                                         implies
     */
    String decrypt(String text, K key);
}
