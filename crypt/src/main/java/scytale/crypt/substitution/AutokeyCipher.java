/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.base.Alphabet;
import scytale.base.TextSymbol;
import scytale.crypt.Cipher;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherKeyException;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.keystream.AutokeyStream;

/**
 * The Autokey cipher: a priming keyword followed by the plaintext itself forms the key, which
 * is added to the text position by position.
 * <p>
 * Every character consumes a key position, letters and other characters alike; see
 * {@link AutokeyStream}. Decryption is strictly sequential, since the key for a position past
 * the priming keyword is a plaintext character that has to be decrypted first.
 * </p>
 */
public final class AutokeyCipher implements Cipher<KeywordKey> {
    private static final Logger logger = LoggerFactory.getLogger(AutokeyCipher.class);

    @Override
    public CipherType getType() {
        return CipherType.AUTOKEY;
    }

    @Override
    public String encrypt(String text, KeywordKey key) {
        AutokeyStream stream = new AutokeyStream(primingKey(key), text);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            TextSymbol symbol = Alphabet.classify(text.charAt(i));
            if (symbol instanceof TextSymbol.Letter letter) {
                sb.append(letter.withResidue(letter.residue() + stream.keyAt(i)).toChar());
            } else {
                sb.append(symbol.toChar());
            }
        }
        return sb.toString();
    }

    @Override
    public String decrypt(String text, KeywordKey key) {
        StringBuilder plaintext = new StringBuilder(text.length());
        // the output buffer doubles as the tail of the key
        AutokeyStream stream = new AutokeyStream(primingKey(key), plaintext);
        for (int i = 0; i < text.length(); i++) {
            TextSymbol symbol = Alphabet.classify(text.charAt(i));
            if (symbol instanceof TextSymbol.Letter letter) {
                plaintext.append(letter.withResidue(letter.residue() - stream.keyAt(i)).toChar());
            } else {
                plaintext.append(symbol.toChar());
            }
        }
        return plaintext.toString();
    }

    private static String primingKey(KeywordKey key) {
        if (!Alphabet.isAlphabetic(key.keyword())) {
            logger.debug("Rejecting autokey priming key \"{}\"", key.keyword());
            throw new InvalidCipherKeyException(
                "Priming key must be a non-empty string of letters: \"" + key.keyword() + "\"");
        }
        return key.normalized();
    }
}
