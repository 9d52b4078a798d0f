/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherParameterException;
import scytale.crypt.key.RailKey;

/**
 * The Rail Fence cipher: the text is written in a zigzag across a number of rails and read off
 * rail by rail. No padding is ever added.
 *
 * @see Zigzag
 */
public final class RailFenceCipher extends AbstractTranspositionCipher<RailKey> {
    private static final Logger logger = LoggerFactory.getLogger(RailFenceCipher.class);

    public RailFenceCipher() {
        super(CipherType.RAIL_FENCE);
    }

    @Override
    public String encrypt(String text, RailKey key) {
        String canonical = canonicalize(text);
        return readOrder(canonical.length(), key).apply(canonical);
    }

    @Override
    public String decrypt(String text, RailKey key) {
        String canonical = canonicalize(text);
        return readOrder(canonical.length(), key).invert(canonical);
    }

    private static Transposition readOrder(int length, RailKey key) {
        int rails = key.rails();
        if (rails < 2 || rails > length) {
            logger.debug("Rejecting {} rails for text of length {}", rails, length);
            throw new InvalidCipherParameterException(
                "Number of rails must be between 2 and the text length " + length + ", got " +
                rails);
        }
        return Zigzag.readOrder(length, rails);
    }
}
