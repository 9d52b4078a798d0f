/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.polygraphic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.base.Alphabet;
import scytale.base.TextFilter;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherKeyException;
import scytale.crypt.InvalidCipherParameterException;
import scytale.crypt.PaddingCipher;
import scytale.crypt.key.MatrixKey;
import scytale.crypt.math.ModularMatrix;

/**
 * The Hill cipher: blocks of {@code n} letters, taken as column vectors, are multiplied by an
 * {@code n x n} key matrix modulo 26. Decryption multiplies by the key's modular inverse.
 * <p>
 * The cipher works on the letters of the text only, upper cased; the final block is padded
 * with {@link TextFilter#PAD_CHAR}. The key's determinant must be coprime with 26.
 * </p>
 */
public final class HillCipher implements PaddingCipher<MatrixKey> {
    private static final Logger logger = LoggerFactory.getLogger(HillCipher.class);

    @Override
    public CipherType getType() {
        return CipherType.HILL;
    }

    @Override
    public String canonicalize(String text) {
        return TextFilter.lettersOnly(text);
    }

    @Override
    public String encrypt(String text, MatrixKey key) {
        ModularMatrix matrix = validatedMatrix(key);
        String canonical = canonicalize(text);
        String padded = TextFilter.pad(canonical, matrix.size());
        logger.trace(
            "Hill encryption of {} letters with block size {}, padding {}", canonical.length(),
            matrix.size(), padded.length() - canonical.length());
        return transformBlocks(padded, matrix);
    }

    @Override
    public String decrypt(String text, MatrixKey key) {
        ModularMatrix inverse = validatedMatrix(key).modularInverse(Alphabet.SIZE);
        String canonical = canonicalize(text);
        if (canonical.length() % inverse.size() != 0) {
            throw new InvalidCipherParameterException(
                "Ciphertext of " + canonical.length() +
                " letters is not a whole number of blocks of " + inverse.size());
        }
        return transformBlocks(canonical, inverse);
    }

    /**
     * Returns the modular inverse of the key matrix, the matrix decryption multiplies by.
     *
     * @param key the key
     *
     * @return the inverse modulo 26
     *
     * @throws InvalidCipherKeyException if the key has no inverse modulo 26
     */
    public ModularMatrix decryptionMatrix(MatrixKey key) {
        return validatedMatrix(key).modularInverse(Alphabet.SIZE);
    }

    private static ModularMatrix validatedMatrix(MatrixKey key) {
        ModularMatrix matrix = new ModularMatrix(key.toArray());
        if (!matrix.isInvertible(Alphabet.SIZE)) {
            long det = matrix.determinant(Alphabet.SIZE);
            logger.debug("Rejecting Hill key {} with determinant {} (mod 26)", matrix, det);
            throw new InvalidCipherKeyException(
                "Key matrix determinant " + det + " (mod " + Alphabet.SIZE +
                ") is not invertible modulo " + Alphabet.SIZE);
        }
        return matrix;
    }

    private static String transformBlocks(String letters, ModularMatrix matrix) {
        int n = matrix.size();
        StringBuilder sb = new StringBuilder(letters.length());
        int[] block = new int[n];
        for (int start = 0; start < letters.length(); start += n) {
            for (int j = 0; j < n; j++) {
                block[j] = Alphabet.residue(letters.charAt(start + j));
            }
            for (int residue : matrix.multiply(block, Alphabet.SIZE)) {
                sb.append(Alphabet.fromResidue(residue, true));
            }
        }
        return sb.toString();
    }
}
