/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.math;

import org.junit.jupiter.api.Test;
import scytale.crypt.InvalidCipherKeyException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ModularMatrixTest {
    private static final int[][] HILL_2X2 = {{2, 1}, {3, 4}};
    private static final int[][] HILL_3X3 = {{6, 24, 1}, {13, 16, 10}, {20, 17, 15}};

    @Test
    void testDeterminant() {
        assertEquals(5, new ModularMatrix(HILL_2X2).determinant());
        assertEquals(441, new ModularMatrix(HILL_3X3).determinant());
        assertEquals(-7, new ModularMatrix(new int[][]{{-7}}).determinant());
        assertEquals(0, new ModularMatrix(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 8, 9}})
            .determinant());
    }

    @Test
    void testAdjugate() {
        assertEquals(
            new ModularMatrix(new int[][]{{4, -2}, {-3, 1}}),
            new ModularMatrix(new int[][]{{1, 2}, {3, 4}}).adjugate());
        assertEquals(new ModularMatrix(new int[][]{{1}}),
                     new ModularMatrix(new int[][]{{9}}).adjugate());
    }

    @Test
    void testAdjugateTimesMatrixIsDeterminantIdentity() {
        ModularMatrix m = new ModularMatrix(HILL_3X3);
        ModularMatrix adj = m.adjugate();
        long det = m.determinant();
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                long sum = 0;
                for (int k = 0; k < 3; k++) {
                    sum += m.get(i, k) * adj.get(k, j);
                }
                assertEquals(i == j ? det : 0, sum, "(" + i + ", " + j + ")");
            }
        }
    }

    @Test
    void testModularInverse2x2() {
        ModularMatrix inverse = new ModularMatrix(HILL_2X2).modularInverse(26);
        assertArrayEquals(new int[][]{{6, 5}, {15, 16}}, inverse.toIntArray());
    }

    @Test
    void testModularInverse3x3() {
        ModularMatrix inverse = new ModularMatrix(HILL_3X3).modularInverse(26);
        assertArrayEquals(new int[][]{{8, 5, 10}, {21, 8, 21}, {21, 12, 8}},
                          inverse.toIntArray());
    }

    @Test
    void testInverseUndoesMultiply() {
        ModularMatrix m = new ModularMatrix(HILL_3X3);
        ModularMatrix inverse = m.modularInverse(26);
        int[] vector = {0, 2, 19};
        int[] encrypted = m.multiply(vector, 26);
        assertArrayEquals(new int[]{15, 14, 7}, encrypted);
        assertArrayEquals(vector, inverse.multiply(encrypted, 26));
    }

    @Test
    void testNegativeEntriesReduce() {
        ModularMatrix m = new ModularMatrix(new int[][]{{-24, 1}, {3, -22}});
        assertEquals(new ModularMatrix(HILL_2X2).modularInverse(26), m.modularInverse(26));
    }

    @Test
    void testModularDeterminant() {
        assertEquals(5, new ModularMatrix(HILL_2X2).determinant(26));
        assertEquals(441 % 26, new ModularMatrix(HILL_3X3).determinant(26));
        assertEquals(19, new ModularMatrix(new int[][]{{-7}}).determinant(26));
        assertEquals(0, new ModularMatrix(new int[][]{{1, 2, 3}, {4, 5, 6}, {7, 8, 9}})
            .determinant(26));
        assertEquals(2, new ModularMatrix(new int[][]{{2, 1}, {4, 3}}).determinant(26));
        // a row swap is needed when the first pivot is zero
        assertEquals(25, new ModularMatrix(new int[][]{{0, 1}, {1, 0}}).determinant(26));
    }

    @Test
    void testLargeBlockInverse() {
        int n = 12;
        ModularMatrix m = new ModularMatrix(unitDeterminant(n));
        assertEquals(1, m.determinant(26));

        ModularMatrix inverse =
            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> m.modularInverse(26));
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                long sum = 0;
                for (int k = 0; k < n; k++) {
                    sum += m.get(i, k) * inverse.get(k, j);
                }
                assertEquals(i == j ? 1 : 0, Math.floorMod(sum, 26L), "(" + i + ", " + j + ")");
            }
        }
    }

    @Test
    void testSingular() {
        ModularMatrix zeroDet = new ModularMatrix(new int[][]{{2, 4}, {1, 2}});
        assertFalse(zeroDet.isInvertible(26));
        assertThrows(InvalidCipherKeyException.class, () -> zeroDet.modularInverse(26));

        // determinant 2 is non-zero but shares a factor with 26
        ModularMatrix evenDet = new ModularMatrix(new int[][]{{2, 1}, {4, 3}});
        assertFalse(evenDet.isInvertible(26));
        assertThrows(InvalidCipherKeyException.class, () -> evenDet.modularInverse(26));
    }

    @Test
    void testShapeValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ModularMatrix(new int[0][0]));
        assertThrows(IllegalArgumentException.class,
                     () -> new ModularMatrix(new int[][]{{1, 2}, {3}}));
        assertThrows(IllegalArgumentException.class,
                     () -> new ModularMatrix(HILL_2X2).multiply(new int[]{1}, 26));
    }

    /**
     * Builds {@code L * U mod 26} from unit lower and upper triangular factors, so the
     * determinant is 1 while every entry is generally non-zero.
     */
    private static int[][] unitDeterminant(int n) {
        int[][] lower = new int[n][n];
        int[][] upper = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                lower[i][j] = i == j ? 1 : i > j ? (7 * i + 3 * j) % 26 : 0;
                upper[i][j] = i == j ? 1 : i < j ? (5 * i + 11 * j) % 26 : 0;
            }
        }
        int[][] out = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int sum = 0;
                for (int k = 0; k < n; k++) {
                    sum += lower[i][k] * upper[k][j];
                }
                out[i][j] = sum % 26;
            }
        }
        return out;
    }
}
