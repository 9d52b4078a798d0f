package scytale.crypt.key;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import scytale.crypt.InvalidCipherKeyException;

/**
 * The square key matrix of a Hill cipher. The block size of the cipher is the matrix dimension.
 *
 * @param rows the matrix rows, each a list of the same length as the number of rows
 */
public record MatrixKey(List<List<Integer>> rows) implements CipherKey {
  public MatrixKey {
    Objects.requireNonNull(rows, "rows");
    if (rows.isEmpty()) {
      throw new InvalidCipherKeyException("Key matrix must not be empty");
    }
    List<List<Integer>> copy = new ArrayList<>(rows.size());
    for (List<Integer> row : rows) {
      if (row == null || row.size() != rows.size()) {
        throw new InvalidCipherKeyException(
            "Key matrix must be square, got a row of "
                + (row == null ? "null" : row.size() + " entries")
                + " in a matrix of "
                + rows.size()
                + " rows");
      }
      copy.add(List.copyOf(row));
    }
    rows = List.copyOf(copy);
  }

  /**
   * Creates a key from a two-dimensional array.
   *
   * @param matrix the key matrix, which must be square
   * @throws InvalidCipherKeyException if the matrix is empty or not square
   */
  public MatrixKey(int[][] matrix) {
    this(toList(matrix));
  }

  private static List<List<Integer>> toList(int[][] matrix) {
    Objects.requireNonNull(matrix, "matrix");
    List<List<Integer>> rows = new ArrayList<>(matrix.length);
    for (int[] row : matrix) {
      if (row == null) {
        throw new InvalidCipherKeyException("Key matrix must not contain null rows");
      }
      List<Integer> r = new ArrayList<>(row.length);
      for (int v : row) {
        r.add(v);
      }
      rows.add(r);
    }
    return rows;
  }

  /**
   * Returns the matrix dimension, which is the block size of the cipher.
   *
   * @return the number of rows (and columns)
   */
  public int size() {
    return rows.size();
  }

  /**
   * Returns a fresh copy of the matrix as an array.
   *
   * @return the matrix entries
   */
  public int[][] toArray() {
    int n = rows.size();
    int[][] out = new int[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        out[i][j] = rows.get(i).get(j);
      }
    }
    return out;
  }
}
