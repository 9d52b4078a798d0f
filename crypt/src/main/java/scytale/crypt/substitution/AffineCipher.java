/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.substitution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.base.Alphabet;
import scytale.crypt.CipherType;
import scytale.crypt.InvalidCipherKeyException;
import scytale.crypt.key.AffineKey;
import scytale.crypt.math.ModularArithmetic;

import java.util.function.IntUnaryOperator;

/**
 * The Affine cipher, {@code E(x) = (a*x + b) mod 26} and {@code D(x) = a^-1 * (x - b) mod 26}.
 * The multiplier {@code a} must be coprime with 26 for the inverse to exist.
 */
public final class AffineCipher extends AbstractSubstitutionCipher<AffineKey> {
    private static final Logger logger = LoggerFactory.getLogger(AffineCipher.class);

    public AffineCipher() {
        super(CipherType.AFFINE);
    }

    @Override
    protected void validateKey(AffineKey key) {
        if (!ModularArithmetic.isInvertible(key.a(), Alphabet.SIZE)) {
            logger.debug("Rejecting affine multiplier {}", key.a());
            throw new InvalidCipherKeyException(
                "Affine multiplier a=" + key.a() + " must be coprime with " + Alphabet.SIZE);
        }
    }

    @Override
    protected IntUnaryOperator encryption(AffineKey key) {
        int a = Math.floorMod(key.a(), Alphabet.SIZE);
        int b = Math.floorMod(key.b(), Alphabet.SIZE);
        return x -> a * x + b;
    }

    @Override
    protected IntUnaryOperator decryption(AffineKey key) {
        int inverse = ModularArithmetic.inverse(key.a(), Alphabet.SIZE);
        int b = Math.floorMod(key.b(), Alphabet.SIZE);
        return x -> inverse * (x - b);
    }
}
