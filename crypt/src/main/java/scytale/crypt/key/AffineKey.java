package scytale.crypt.key;

/**
 * The key of the Affine cipher, {@code E(x) = (a*x + b) mod 26}.
 *
 * @param a the multiplier; the cipher requires it to be coprime with 26
 * @param b the offset
 */
public record AffineKey(int a, int b) implements CipherKey {}
