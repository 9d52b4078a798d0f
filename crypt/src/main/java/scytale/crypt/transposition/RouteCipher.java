/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.base.TextFilter;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherParameterException;
import scytale.crypt.key.RouteKey;

/**
 * The Route cipher: the text is written row by row into a {@code rows x cols} grid, padded with
 * {@link TextFilter#PAD_CHAR} to fill it, and read off along a {@link RoutePattern}.
 * Decryption places the ciphertext along the same route and reads the grid row by row.
 */
public final class RouteCipher extends AbstractTranspositionCipher<RouteKey> {
    private static final Logger logger = LoggerFactory.getLogger(RouteCipher.class);

    public RouteCipher() {
        super(CipherType.ROUTE);
    }

    @Override
    public String encrypt(String text, RouteKey key) {
        int cells = cells(key);
        String canonical = canonicalize(text);
        if (canonical.length() > cells) {
            logger.debug("Text of length {} overflows a {}x{} grid", canonical.length(),
                         key.rows(), key.cols());
            throw new InvalidCipherParameterException(
                "Text of length " + canonical.length() + " does not fit a " + key.rows() + "x" +
                key.cols() + " grid");
        }
        String padded = StringUtils.rightPad(canonical, cells, TextFilter.PAD_CHAR);
        CoordinateOrder route = key.pattern().order(key.rows(), key.cols());
        logger.trace("Route {} over {} with padding {}", key.pattern(), route,
                     cells - canonical.length());
        return Grid.ofRows(padded, key.rows(), key.cols()).read(route);
    }

    @Override
    public String decrypt(String text, RouteKey key) {
        int cells = cells(key);
        String canonical = canonicalize(text);
        if (canonical.length() != cells) {
            logger.debug("Ciphertext of length {} does not fill a {}x{} grid",
                         canonical.length(), key.rows(), key.cols());
            throw new InvalidCipherParameterException(
                "Ciphertext length " + canonical.length() + " must equal rows * cols = " + cells);
        }
        CoordinateOrder route = key.pattern().order(key.rows(), key.cols());
        return Grid.fill(route, canonical).toRowMajorString();
    }

    private static int cells(RouteKey key) {
        if (key.rows() < 1 || key.cols() < 1) {
            throw new InvalidCipherParameterException(
                "Rows and columns must be at least 1, got " + key.rows() + "x" + key.cols());
        }
        if (key.cells() > Integer.MAX_VALUE) {
            throw new InvalidCipherParameterException(
                "Grid " + key.rows() + "x" + key.cols() + " is too large");
        }
        return (int) key.cells();
    }
}
