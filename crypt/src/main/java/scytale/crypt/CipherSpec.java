/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import scytale.crypt.key.CipherKey;

import java.util.Objects;

/**
 * A cipher variant paired with a key of the variant it accepts. This is the unit that {@link
 * Ciphers} dispatches on.
 *
 * @param type the cipher variant
 * @param key  the key
 */
public record CipherSpec(CipherType type, CipherKey key) {
    public CipherSpec {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
        if (!type.accepts(key)) {
            throw new InvalidCipherKeyException(
                type + " requires a " + type.keyClass.getSimpleName() + ", got a " +
                key.getClass().getSimpleName());
        }
    }
}
