/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import scytale.crypt.CipherType;
import scytale.crypt.key.ShiftKey;
import scytale.crypt.keystream.KeyStream;
import scytale.crypt.keystream.ProgressiveKeyStream;

import java.util.function.IntUnaryOperator;

/**
 * The August cipher: a Caesar shift that grows by one with every letter, starting from the
 * key's shift ({@link ShiftKey#DEFAULT_AUGUST_SHIFT} by convention).
 */
public final class AugustCipher extends AbstractSubstitutionCipher<ShiftKey> {

    public AugustCipher() {
        super(CipherType.AUGUST);
    }

    @Override
    protected IntUnaryOperator encryption(ShiftKey key) {
        KeyStream shifts = new ProgressiveKeyStream(key.shift());
        return x -> x + shifts.next();
    }

    @Override
    protected IntUnaryOperator decryption(ShiftKey key) {
        KeyStream shifts = new ProgressiveKeyStream(key.shift());
        return x -> x - shifts.next();
    }
}
