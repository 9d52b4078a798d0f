/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import scytale.crypt.CipherType;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.keystream.KeyStream;
import scytale.crypt.keystream.RepeatingKeyStream;

import java.util.function.IntUnaryOperator;

/**
 * The Beaufort cipher: each letter is subtracted from the repeating keyword,
 * {@code (k - x) mod 26}. Encryption and decryption are the same function.
 */
public final class BeaufortCipher extends AbstractSubstitutionCipher<KeywordKey> {

    public BeaufortCipher() {
        super(CipherType.BEAUFORT);
    }

    @Override
    protected IntUnaryOperator encryption(KeywordKey key) {
        KeyStream stream = new RepeatingKeyStream(key.keyword());
        return x -> stream.next() - x;
    }

    @Override
    protected IntUnaryOperator decryption(KeywordKey key) {
        return encryption(key);
    }
}
