/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import scytale.base.TextFilter;
import scytale.crypt.CipherType;
import scytale.crypt.PaddingCipher;
import scytale.crypt.key.CipherKey;

/**
 * Base class for ciphers that rearrange characters without changing them.
 * <p>
 * Transposition ciphers work on the alphanumeric characters of their input, upper cased; spaces
 * and punctuation are dropped on both encryption and decryption. Output is always upper case.
 * </p>
 *
 * @param <K> the key variant
 */
public abstract class AbstractTranspositionCipher<K extends CipherKey>
    implements PaddingCipher<K> {

    protected AbstractTranspositionCipher(CipherType type) {
        this.type = type;
    }

    @Override
    public final CipherType getType() {
        return type;
    }

    @Override
    public String canonicalize(String text) {
        return TextFilter.alphanumericOnly(text);
    }

    private final CipherType type;
}
