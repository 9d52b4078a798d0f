/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import scytale.crypt.key.AffineKey;
import scytale.crypt.key.CipherKey;
import scytale.crypt.key.EmptyKey;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.key.MatrixKey;
import scytale.crypt.key.RailKey;
import scytale.crypt.key.RouteKey;
import scytale.crypt.key.ShiftKey;

import java.util.Locale;

/**
 * The cipher variants available in Scytale, with the properties callers need to choose and
 * configure one: its family, the key variant it accepts, and whether it is reciprocal or pads
 * its input.
 *
 * @see Ciphers
 * @see CipherSpec
 */
public enum CipherType {
    /**
     * Fixed shift of every letter.
     */
    CAESAR(Family.SUBSTITUTION, ShiftKey.class, false, false),

    /**
     * Letter-wise {@code (a*x + b) mod 26}.
     */
    AFFINE(Family.SUBSTITUTION, AffineKey.class, false, false),

    /**
     * Reversed alphabet, {@code 25 - x}. Reciprocal.
     */
    ATBASH(Family.SUBSTITUTION, EmptyKey.class, true, false),

    /**
     * Shift that grows by one with every letter.
     */
    AUGUST(Family.POLYALPHABETIC, ShiftKey.class, false, false),

    /**
     * Repeating keyword added to the text.
     */
    VIGENERE(Family.POLYALPHABETIC, KeywordKey.class, false, false),

    /**
     * Text subtracted from a repeating keyword. Reciprocal.
     */
    BEAUFORT(Family.POLYALPHABETIC, KeywordKey.class, true, false),

    /**
     * Priming keyword followed by the plaintext itself.
     */
    AUTOKEY(Family.POLYALPHABETIC, KeywordKey.class, false, false),

    /**
     * Matrix product over blocks of letters.
     */
    HILL(Family.POLYGRAPHIC, MatrixKey.class, false, true),

    /**
     * Zigzag over a number of rails.
     */
    RAIL_FENCE(Family.TRANSPOSITION, RailKey.class, false, true),

    /**
     * Grid read along a route.
     */
    ROUTE(Family.TRANSPOSITION, RouteKey.class, false, true),

    /**
     * Columnar transposition reading equal key letters together.
     */
    MYSZKOWSKI(Family.TRANSPOSITION, KeywordKey.class, false, true);

    /**
     * The broad classes of classical cipher.
     */
    public enum Family {
        /** One fixed alphabet substitution for the whole text. */
        SUBSTITUTION,
        /** The substitution alphabet changes from letter to letter. */
        POLYALPHABETIC,
        /** Letters are substituted in blocks. */
        POLYGRAPHIC,
        /** Letters keep their identity and change position. */
        TRANSPOSITION
    }

    /**
     * The family this cipher belongs to.
     */
    public final Family family;

    /**
     * The key variant this cipher accepts.
     */
    public final Class<? extends CipherKey> keyClass;

    /**
     * Whether encryption and decryption are the same function.
     */
    public final boolean reciprocal;

    /**
     * Whether the cipher works on a filtered, upper case form of the text and may pad it. Such
     * ciphers implement {@link PaddingCipher}.
     */
    public final boolean padded;

    CipherType(
        Family family, Class<? extends CipherKey> keyClass, boolean reciprocal,
        boolean padded) {
        this.family = family;
        this.keyClass = keyClass;
        this.reciprocal = reciprocal;
        this.padded = padded;
    }

    /**
     * Returns whether {@code key} is of the variant this cipher accepts.
     *
     * @param key the key to test
     *
     * @return {@code true} if the key can be passed to this cipher
     */
    public boolean accepts(CipherKey key) {
        return keyClass.isInstance(key);
    }

    /**
     * Looks up a cipher type by name. Matching ignores case and treats {@code '-'} and
     * {@code ' '} as {@code '_'}, so {@code "rail-fence"} names {@link #RAIL_FENCE}.
     *
     * @param name the name to look up
     *
     * @return the matching type
     *
     * @throws InvalidCipherParameterException if no type has that name
     */
    public static CipherType fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (CipherType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new InvalidCipherParameterException("Unknown cipher: " + name);
    }
}
