/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt;

import scytale.crypt.key.CipherKey;
import scytale.crypt.polygraphic.HillCipher;
import scytale.crypt.substitution.AffineCipher;
import scytale.crypt.substitution.AtbashCipher;
import scytale.crypt.substitution.AugustCipher;
import scytale.crypt.substitution.AutokeyCipher;
import scytale.crypt.substitution.BeaufortCipher;
import scytale.crypt.substitution.CaesarCipher;
import scytale.crypt.substitution.VigenereCipher;
import scytale.crypt.transposition.MyszkowskiCipher;
import scytale.crypt.transposition.RailFenceCipher;
import scytale.crypt.transposition.RouteCipher;

/**
 * Entry point to the cipher catalog: one shared, stateless instance per {@link CipherType},
 * and encryption and decryption dispatched on a {@link CipherSpec}.
 */
public final class Ciphers {
    public static final CaesarCipher CAESAR = new CaesarCipher();
    public static final AffineCipher AFFINE = new AffineCipher();
    public static final AtbashCipher ATBASH = new AtbashCipher();
    public static final AugustCipher AUGUST = new AugustCipher();
    public static final VigenereCipher VIGENERE = new VigenereCipher();
    public static final BeaufortCipher BEAUFORT = new BeaufortCipher();
    public static final AutokeyCipher AUTOKEY = new AutokeyCipher();
    public static final HillCipher HILL = new HillCipher();
    public static final RailFenceCipher RAIL_FENCE = new RailFenceCipher();
    public static final RouteCipher ROUTE = new RouteCipher();
    public static final MyszkowskiCipher MYSZKOWSKI = new MyszkowskiCipher();

    private Ciphers() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the implementation of a cipher variant.
     *
     * @param type the variant
     *
     * @return the shared instance; {@code get(type).getType() == type}
     */
    public static Cipher<?> get(CipherType type) {
        return switch (type) {
            case CAESAR -> CAESAR;
            case AFFINE -> AFFINE;
            case ATBASH -> ATBASH;
            case AUGUST -> AUGUST;
            case VIGENERE -> VIGENERE;
            case BEAUFORT -> BEAUFORT;
            case AUTOKEY -> AUTOKEY;
            case HILL -> HILL;
            case RAIL_FENCE -> RAIL_FENCE;
            case ROUTE -> ROUTE;
            case MYSZKOWSKI -> MYSZKOWSKI;
        };
    }

    /**
     * Encrypts {@code text} with the cipher and key of {@code spec}.
     *
     * @param spec the cipher and key
     * @param text the plaintext
     *
     * @return the ciphertext
     *
     * @throws CipherException if the key or a parameter is rejected
     */
    public static String encrypt(CipherSpec spec, String text) {
        return cipherFor(spec).encrypt(text, spec.key());
    }

    /**
     * Decrypts {@code text} with the cipher and key of {@code spec}. For ciphers that pad, the
     * result still carries the padding; see {@link #decrypt(CipherSpec, CipherResult)}.
     *
     * @param spec the cipher and key
     * @param text the ciphertext
     *
     * @return the plaintext
     *
     * @throws CipherException if the key or a parameter is rejected
     */
    public static String decrypt(CipherSpec spec, String text) {
        return cipherFor(spec).decrypt(text, spec.key());
    }

    /**
     * Encrypts {@code text} and records the padding added. Ciphers that never pad report zero.
     *
     * @param spec the cipher and key
     * @param text the plaintext
     *
     * @return the ciphertext and pad count
     */
    public static CipherResult encryptWithPadding(CipherSpec spec, String text) {
        if (!spec.type().padded) {
            return new CipherResult(encrypt(spec, text), 0);
        }
        return paddingCipherFor(spec).encryptWithPadding(text, spec.key());
    }

    /**
     * Decrypts a result of {@link #encryptWithPadding(CipherSpec, String)}, stripping the
     * recorded padding.
     *
     * @param spec   the cipher and key
     * @param result the ciphertext and pad count
     *
     * @return the plaintext without padding
     */
    public static String decrypt(CipherSpec spec, CipherResult result) {
        if (!spec.type().padded) {
            if (result.padding() != 0) {
                throw new InvalidCipherParameterException(
                    spec.type() + " does not pad, but the result records padding " +
                    result.padding());
            }
            return decrypt(spec, result.text());
        }
        return paddingCipherFor(spec).decrypt(result, spec.key());
    }

    // CipherSpec guarantees the key is of the variant the cipher accepts
    @SuppressWarnings("unchecked")
    private static Cipher<CipherKey> cipherFor(CipherSpec spec) {
        return (Cipher<CipherKey>) get(spec.type());
    }

    @SuppressWarnings("unchecked")
    private static PaddingCipher<CipherKey> paddingCipherFor(CipherSpec spec) {
        return (PaddingCipher<CipherKey>) get(spec.type());
    }
}
