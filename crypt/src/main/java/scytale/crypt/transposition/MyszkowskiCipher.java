/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherKeyException;
import scytale.crypt.InvalidCipherParameterException;
import scytale.crypt.key.KeywordKey;

/**
 * The Myszkowski transposition: a columnar transposition in which columns sharing a key letter
 * are read together. The text is written row by row under the key, padded to a whole number of
 * rows, and read off in the order of {@link ColumnGrouping}.
 */
public final class MyszkowskiCipher extends AbstractTranspositionCipher<KeywordKey> {
    private static final Logger logger = LoggerFactory.getLogger(MyszkowskiCipher.class);

    public MyszkowskiCipher() {
        super(CipherType.MYSZKOWSKI);
    }

    @Override
    public String encrypt(String text, KeywordKey key) {
        String columnKey = columnKey(key);
        Grid grid = Grid.padded(canonicalize(text), columnKey.length());
        logger.trace("Myszkowski grid {}x{}", grid.rows(), grid.cols());
        return grid.read(ColumnGrouping.order(columnKey, grid.rows()));
    }

    @Override
    public String decrypt(String text, KeywordKey key) {
        String columnKey = columnKey(key);
        String canonical = canonicalize(text);
        int cols = columnKey.length();
        if (canonical.length() % cols != 0) {
            throw new InvalidCipherParameterException(
                "Ciphertext length " + canonical.length() +
                " is not a multiple of the key length " + cols);
        }
        int rows = canonical.length() / cols;
        return Grid.fill(ColumnGrouping.order(columnKey, rows), canonical).toRowMajorString();
    }

    private static String columnKey(KeywordKey key) {
        if (key.keyword().isEmpty()) {
            logger.debug("Rejecting empty Myszkowski key");
            throw new InvalidCipherKeyException("Myszkowski key must not be empty");
        }
        return key.normalized();
    }
}
