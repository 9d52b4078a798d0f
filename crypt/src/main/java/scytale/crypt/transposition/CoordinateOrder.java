/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordering of every cell of a {@code rows x cols} grid, each cell exactly once. It fixes the
 * sequence in which a transposition cipher reads a grid on encryption and fills it on
 * decryption.
 * <p>
 * The generators are pure functions of the grid dimensions, so the order used to encrypt can
 * always be regenerated to decrypt.
 * </p>
 */
public final class CoordinateOrder {

    /**
     * Creates an order from an explicit list of cells.
     *
     * @param rows        the number of grid rows
     * @param cols        the number of grid columns
     * @param coordinates the cells in order
     *
     * @throws IllegalArgumentException if the cells do not cover the grid exactly once
     */
    public CoordinateOrder(int rows, int cols, List<Coordinate> coordinates) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Negative grid size " + rows + "x" + cols);
        }
        if (coordinates.size() != rows * cols) {
            throw new IllegalArgumentException(
                coordinates.size() + " coordinates cannot cover a " + rows + "x" + cols + " grid");
        }
        boolean[] seen = new boolean[rows * cols];
        for (Coordinate c : coordinates) {
            if (c.row() >= rows || c.col() >= cols) {
                throw new IllegalArgumentException(c + " lies outside a " + rows + "x" + cols +
                                                   " grid");
            }
            int index = c.row() * cols + c.col();
            if (seen[index]) {
                throw new IllegalArgumentException(c + " appears twice");
            }
            seen[index] = true;
        }
        this.rows = rows;
        this.cols = cols;
        this.coordinates = List.copyOf(coordinates);
    }

    /**
     * Row by row, left to right: the order in which text is written into a grid.
     *
     * @param rows the number of grid rows
     * @param cols the number of grid columns
     *
     * @return the row-major order
     */
    public static CoordinateOrder rowMajor(int rows, int cols) {
        List<Coordinate> out = new ArrayList<>(rows * cols);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                out.add(new Coordinate(r, c));
            }
        }
        return new CoordinateOrder(rows, cols, out);
    }

    /**
     * Clockwise rings from the outside in: top row left to right, right column downwards,
     * bottom row right to left, left column upwards, then the next ring inside.
     *
     * @param rows the number of grid rows
     * @param cols the number of grid columns
     *
     * @return the inward spiral
     */
    public static CoordinateOrder spiralIn(int rows, int cols) {
        List<Coordinate> out = new ArrayList<>(rows * cols);
        int top = 0;
        int bottom = rows - 1;
        int left = 0;
        int right = cols - 1;
        while (top <= bottom && left <= right) {
            for (int c = left; c <= right; c++) {
                out.add(new Coordinate(top, c));
            }
            top++;
            for (int r = top; r <= bottom; r++) {
                out.add(new Coordinate(r, right));
            }
            right--;
            if (top <= bottom) {
                for (int c = right; c >= left; c--) {
                    out.add(new Coordinate(bottom, c));
                }
                bottom--;
            }
            if (left <= right) {
                for (int r = bottom; r >= top; r--) {
                    out.add(new Coordinate(r, left));
                }
                left++;
            }
        }
        return new CoordinateOrder(rows, cols, out);
    }

    /**
     * The inward spiral traversed backwards, ending at the top left corner.
     *
     * @param rows the number of grid rows
     * @param cols the number of grid columns
     *
     * @return the outward spiral
     */
    public static CoordinateOrder spiralOut(int rows, int cols) {
        return spiralIn(rows, cols).reversed();
    }

    /**
     * Boustrophedon: even rows left to right, odd rows right to left.
     *
     * @param rows the number of grid rows
     * @param cols the number of grid columns
     *
     * @return the snake order
     */
    public static CoordinateOrder snake(int rows, int cols) {
        List<Coordinate> out = new ArrayList<>(rows * cols);
        for (int r = 0; r < rows; r++) {
            if (r % 2 == 0) {
                for (int c = 0; c < cols; c++) {
                    out.add(new Coordinate(r, c));
                }
            } else {
                for (int c = cols - 1; c >= 0; c--) {
                    out.add(new Coordinate(r, c));
                }
            }
        }
        return new CoordinateOrder(rows, cols, out);
    }

    /**
     * Anti-diagonals in increasing {@code row + col}, each from its topmost cell downwards.
     *
     * @param rows the number of grid rows
     * @param cols the number of grid columns
     *
     * @return the diagonal order
     */
    public static CoordinateOrder diagonal(int rows, int cols) {
        List<Coordinate> out = new ArrayList<>(rows * cols);
        for (int sum = 0; sum < rows + cols - 1; sum++) {
            for (int r = Math.max(0, sum - cols + 1); r <= Math.min(sum, rows - 1); r++) {
                out.add(new Coordinate(r, sum - r));
            }
        }
        return new CoordinateOrder(rows, cols, out);
    }

    /**
     * Returns this order traversed backwards.
     *
     * @return the reversed order
     */
    public CoordinateOrder reversed() {
        List<Coordinate> copy = new ArrayList<>(coordinates);
        Collections.reverse(copy);
        return new CoordinateOrder(rows, cols, copy);
    }

    /**
     * Expresses this order as a permutation of row-major cell indexes: position {@code k} of
     * the permutation is the row-major index of the {@code k}-th cell.
     *
     * @return the permutation
     */
    public Transposition toTransposition() {
        int[] order = new int[coordinates.size()];
        for (int k = 0; k < order.length; k++) {
            Coordinate c = coordinates.get(k);
            order[k] = c.row() * cols + c.col();
        }
        return new Transposition(order);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int size() {
        return coordinates.size();
    }

    /**
     * Returns the cells in order.
     *
     * @return an unmodifiable list of the cells
     */
    public List<Coordinate> coordinates() {
        return coordinates;
    }

    @Override
    public String toString() {
        return rows + "x" + cols + coordinates;
    }

    private final int rows;
    private final int cols;
    private final List<Coordinate> coordinates;
}
