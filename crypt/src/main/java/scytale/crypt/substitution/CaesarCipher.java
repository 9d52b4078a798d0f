/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import scytale.crypt.CipherType;
import scytale.crypt.key.ShiftKey;
import scytale.crypt.keystream.KeyStream;

import java.util.function.IntUnaryOperator;

/**
 * The Caesar cipher: every letter is shifted by the same amount.
 */
public final class CaesarCipher extends AbstractSubstitutionCipher<ShiftKey> {

    public CaesarCipher() {
        super(CipherType.CAESAR);
    }

    @Override
    protected IntUnaryOperator encryption(ShiftKey key) {
        KeyStream shift = KeyStream.constant(key.shift());
        return x -> x + shift.next();
    }

    @Override
    protected IntUnaryOperator decryption(ShiftKey key) {
        KeyStream shift = KeyStream.constant(key.shift());
        return x -> x - shift.next();
    }
}
