/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

/**
 * Ciphertext produced by a {@link PaddingCipher}, together with the number of pad characters
 * that were appended to the canonical plaintext before encryption.
 *
 * @param text    the ciphertext
 * @param padding the number of trailing pad characters the decrypted text will carry
 */
public record CipherResult(String text, int padding) {
    public CipherResult {
        if (padding < 0) {
            throw new InvalidCipherParameterException("Padding must not be negative: " + padding);
        }
    }
}
