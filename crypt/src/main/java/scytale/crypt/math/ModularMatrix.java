/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.math;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.crypt.InvalidCipherKeyException;

import java.util.Arrays;

/**
 * An immutable square integer matrix with the operations the Hill cipher needs: determinant,
 * adjugate, modular inverse and matrix-vector product modulo a modulus.
 * <p>
 * All arithmetic is exact. {@link #determinant()} and {@link #adjugate()} use cofactor
 * expansion over {@code long} values with overflow checks and throw {@link ArithmeticException}
 * rather than return a rounded value. Cofactor expansion takes factorial time, so those two are
 * meant for small matrices. The modular operations ({@link #determinant(int)},
 * {@link #isInvertible(int)} and {@link #modularInverse(int)}) instead row-reduce over the
 * integers modulo the modulus in cubic time, and work for any block size.
 * </p>
 */
public final class ModularMatrix {
    private static final Logger logger = LoggerFactory.getLogger(ModularMatrix.class);

    /**
     * Creates a matrix from integer entries.
     *
     * @param entries the entries, row by row; must be non-empty and square
     *
     * @throws IllegalArgumentException if the entries are empty or not square
     */
    public ModularMatrix(int[][] entries) {
        this(toLong(entries));
    }

    private ModularMatrix(long[][] entries) {
        if (entries.length == 0) {
            throw new IllegalArgumentException("Matrix must not be empty");
        }
        for (long[] row : entries) {
            if (row.length != entries.length) {
                throw new IllegalArgumentException(
                    "Matrix must be square, got a row of length " + row.length + " in a " +
                    entries.length + "-row matrix");
            }
        }
        this.entries = entries;
    }

    /**
     * Returns the dimension of the matrix.
     *
     * @return the number of rows, equal to the number of columns
     */
    public int size() {
        return entries.length;
    }

    /**
     * Returns one entry.
     *
     * @param row the row index
     * @param col the column index
     *
     * @return the entry at {@code (row, col)}
     */
    public long get(int row, int col) {
        return entries[row][col];
    }

    /**
     * Returns the exact determinant, by cofactor expansion along the first row.
     *
     * @return the determinant
     *
     * @throws ArithmeticException if an intermediate value overflows a {@code long}
     */
    public long determinant() {
        return determinant(entries);
    }

    /**
     * Returns the exact adjugate: the transpose of the cofactor matrix. For every matrix
     * {@code M}, {@code M * adj(M) = det(M) * I}.
     *
     * @return the adjugate
     *
     * @throws ArithmeticException if an intermediate value overflows a {@code long}
     */
    public ModularMatrix adjugate() {
        int n = entries.length;
        long[][] adj = new long[n][n];
        if (n == 1) {
            adj[0][0] = 1;
            return new ModularMatrix(adj);
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                long minor = determinant(minor(entries, i, j));
                long cofactor = ((i + j) % 2 == 0) ? minor : Math.negateExact(minor);
                // transposed: the cofactor of (i, j) lands at (j, i)
                adj[j][i] = cofactor;
            }
        }
        return new ModularMatrix(adj);
    }

    /**
     * Returns this matrix with every entry reduced into {@code [0, modulus)}.
     *
     * @param modulus the modulus, must be positive
     *
     * @return the reduced matrix
     */
    public ModularMatrix mod(int modulus) {
        int n = entries.length;
        long[][] out = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i][j] = Math.floorMod(entries[i][j], (long) modulus);
            }
        }
        return new ModularMatrix(out);
    }

    /**
     * Returns the determinant modulo {@code modulus}, computed by row reduction.
     *
     * @param modulus the modulus, must be positive
     *
     * @return the determinant, in {@code [0, modulus)}
     */
    public long determinant(int modulus) {
        int n = entries.length;
        long[][] rows = mod(modulus).entries;
        return triangularize(rows, n, modulus);
    }

    /**
     * Returns whether this matrix has an inverse modulo {@code modulus}, that is whether its
     * determinant is coprime with the modulus.
     *
     * @param modulus the modulus, must be positive
     *
     * @return {@code true} if {@link #modularInverse(int)} would succeed
     */
    public boolean isInvertible(int modulus) {
        return ModularArithmetic.isInvertible(determinant(modulus), modulus);
    }

    /**
     * Computes the inverse of this matrix modulo {@code modulus}, equal to
     * {@code det^-1 * adj(M) mod modulus}.
     * <p>
     * {@code [M | I]} is reduced to upper triangular form with Euclidean row steps, which stay
     * valid when the modulus is not prime, and then back-substituted. The determinant is the
     * signed product of the diagonal; once it is coprime with the modulus every pivot is a unit.
     * </p>
     *
     * @param modulus the modulus, must be positive
     *
     * @return the inverse, with entries in {@code [0, modulus)}
     *
     * @throws InvalidCipherKeyException if the determinant is not coprime with the modulus
     */
    public ModularMatrix modularInverse(int modulus) {
        int n = entries.length;
        long[][] reduced = mod(modulus).entries;
        long[][] rows = new long[n][2 * n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(reduced[i], 0, rows[i], 0, n);
            rows[i][n + i] = 1 % modulus;
        }
        long det = triangularize(rows, n, modulus);
        if (!ModularArithmetic.isInvertible(det, modulus)) {
            logger.debug("Matrix with determinant {} (mod {}) is not invertible", det, modulus);
            throw new InvalidCipherKeyException(
                "Matrix determinant " + det + " is not invertible modulo " + modulus);
        }
        for (int col = n - 1; col >= 0; col--) {
            scaleRow(rows[col], ModularArithmetic.inverse(rows[col][col], modulus), modulus);
            for (int r = 0; r < col; r++) {
                subtractRow(rows[r], rows[col], rows[r][col], modulus);
            }
        }
        long[][] out = new long[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(rows[i], n, out[i], 0, n);
        }
        return new ModularMatrix(out);
    }

    /**
     * Multiplies this matrix by a column vector, modulo {@code modulus}.
     *
     * @param vector  the vector, of length {@link #size()}
     * @param modulus the modulus, must be positive
     *
     * @return the product, with entries in {@code [0, modulus)}
     *
     * @throws IllegalArgumentException if the vector has the wrong length
     */
    public int[] multiply(int[] vector, int modulus) {
        int n = entries.length;
        if (vector.length != n) {
            throw new IllegalArgumentException(
                "Vector length " + vector.length + " does not match matrix size " + n);
        }
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            long sum = 0;
            for (int j = 0; j < n; j++) {
                sum = Math.floorMod(
                    sum + Math.floorMod(entries[i][j], (long) modulus) * vector[j],
                    (long) modulus);
            }
            out[i] = (int) sum;
        }
        return out;
    }

    /**
     * Returns the entries as a fresh {@code int} array.
     *
     * @return the entries
     *
     * @throws ArithmeticException if an entry does not fit in an {@code int}
     */
    public int[][] toIntArray() {
        int n = entries.length;
        int[][] out = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                out[i][j] = Math.toIntExact(entries[i][j]);
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModularMatrix other)) {
            return false;
        }
        return Arrays.deepEquals(entries, other.entries);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(entries);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(entries);
    }

    private static long determinant(long[][] m) {
        int n = m.length;
        if (n == 1) {
            return m[0][0];
        }
        if (n == 2) {
            return Math.subtractExact(
                Math.multiplyExact(m[0][0], m[1][1]),
                Math.multiplyExact(m[0][1], m[1][0]));
        }
        long det = 0;
        for (int col = 0; col < n; col++) {
            if (m[0][col] == 0) {
                continue;
            }
            long term = Math.multiplyExact(m[0][col], determinant(minor(m, 0, col)));
            det = (col % 2 == 0) ? Math.addExact(det, term) : Math.subtractExact(det, term);
        }
        return det;
    }

    /**
     * Brings the first {@code n} columns of {@code rows} to upper triangular form in place and
     * returns the determinant of that square part modulo {@code modulus}. Entries must already
     * lie in {@code [0, modulus)}. Rows may be wider than {@code n}; every row operation is
     * applied across the whole row.
     */
    private static long triangularize(long[][] rows, int n, int modulus) {
        long det = 1 % modulus;
        for (int col = 0; col < n; col++) {
            for (int row = col + 1; row < n; row++) {
                // Euclid on the two pivot candidates until the lower one is zero
                while (rows[row][col] != 0) {
                    long q = rows[col][col] / rows[row][col];
                    subtractRow(rows[col], rows[row], q, modulus);
                    long[] tmp = rows[col];
                    rows[col] = rows[row];
                    rows[row] = tmp;
                    det = Math.floorMod(-det, (long) modulus);
                }
            }
            det = Math.floorMod(det * rows[col][col], (long) modulus);
        }
        return det;
    }

    /**
     * {@code target -= factor * source}, modulo {@code modulus}.
     */
    private static void subtractRow(long[] target, long[] source, long factor, int modulus) {
        long f = Math.floorMod(factor, (long) modulus);
        for (int j = 0; j < target.length; j++) {
            target[j] = Math.floorMod(target[j] - f * source[j], (long) modulus);
        }
    }

    private static void scaleRow(long[] row, long factor, int modulus) {
        for (int j = 0; j < row.length; j++) {
            row[j] = Math.floorMod(row[j] * factor, (long) modulus);
        }
    }

    /**
     * Returns {@code m} without row {@code skipRow} and column {@code skipCol}.
     */
    private static long[][] minor(long[][] m, int skipRow, int skipCol) {
        int n = m.length;
        long[][] out = new long[n - 1][n - 1];
        int r = 0;
        for (int i = 0; i < n; i++) {
            if (i == skipRow) {
                continue;
            }
            int c = 0;
            for (int j = 0; j < n; j++) {
                if (j == skipCol) {
                    continue;
                }
                out[r][c++] = m[i][j];
            }
            r++;
        }
        return out;
    }

    private static long[][] toLong(int[][] entries) {
        long[][] out = new long[entries.length][];
        for (int i = 0; i < entries.length; i++) {
            out[i] = new long[entries[i].length];
            for (int j = 0; j < entries[i].length; j++) {
                out[i][j] = entries[i][j];
            }
        }
        return out;
    }

    /**
     * Entries, row by row. Never exposed, so the matrix stays immutable.
     */
    private final long[][] entries;
}
