/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.math;

import scytale.crypt.InvalidCipherKeyException;

/**
 * Integer arithmetic modulo a positive modulus, as used by the Affine and Hill ciphers.
 *
 * @see ModularMatrix
 */
public final class ModularArithmetic {

    private ModularArithmetic() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the greatest common divisor of {@code a} and {@code b}, which is never negative.
     * {@code gcd(0, 0)} is 0.
     *
     * @param a the first value
     * @param b the second value
     *
     * @return the greatest common divisor
     */
    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    /**
     * Returns whether {@code a} has a multiplicative inverse modulo {@code modulus}.
     *
     * @param a       the value
     * @param modulus the modulus, must be positive
     *
     * @return {@code true} if {@code gcd(a mod modulus, modulus) == 1}
     */
    public static boolean isInvertible(long a, int modulus) {
        return gcd(Math.floorMod(a, modulus), modulus) == 1;
    }

    /**
     * Computes the multiplicative inverse of {@code a} modulo {@code modulus} with the extended
     * Euclidean algorithm.
     *
     * @param a       the value to invert; any integer, reduced modulo {@code modulus} first
     * @param modulus the modulus, must be positive
     *
     * @return the inverse, in {@code [0, modulus)}
     *
     * @throws InvalidCipherKeyException if {@code a} and {@code modulus} are not coprime
     * @throws IllegalArgumentException  if {@code modulus} is not positive
     */
    public static int inverse(long a, int modulus) {
        if (modulus <= 0) {
            throw new IllegalArgumentException("Modulus must be positive: " + modulus);
        }
        long r0 = modulus;
        long r1 = Math.floorMod(a, modulus);
        long t0 = 0;
        long t1 = 1;
        while (r1 != 0) {
            long q = r0 / r1;
            long r = r0 - q * r1;
            r0 = r1;
            r1 = r;
            long t = t0 - q * t1;
            t0 = t1;
            t1 = t;
        }
        if (r0 != 1) {
            throw new InvalidCipherKeyException(
                a + " has no inverse modulo " + modulus + " (gcd is " + r0 + ")");
        }
        return (int) Math.floorMod(t0, (long) modulus);
    }
}
