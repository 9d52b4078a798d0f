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
 * The Vigenère cipher: the keyword, repeated over the letters of the text, is added to it.
 */
public final class VigenereCipher extends AbstractSubstitutionCipher<KeywordKey> {

    public VigenereCipher() {
        super(CipherType.VIGENERE);
    }

    @Override
    protected IntUnaryOperator encryption(KeywordKey key) {
        KeyStream stream = new RepeatingKeyStream(key.keyword());
        return x -> x + stream.next();
    }

    @Override
    protected IntUnaryOperator decryption(KeywordKey key) {
        KeyStream stream = new RepeatingKeyStream(key.keyword());
        return x -> x - stream.next();
    }
}
