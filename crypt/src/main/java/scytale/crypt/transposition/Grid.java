/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import scytale.base.TextFilter;

/**
 * A {@code rows x cols} block of characters, written row by row. A grid only lives for the
 * duration of a single encryption or decryption.
 */
public final class Grid {

    private Grid(int rows, int cols, char[] cells) {
        this.rows = rows;
        this.cols = cols;
        this.cells = cells;
    }

    /**
     * Writes {@code text} into a grid row by row.
     *
     * @param text the text, of length exactly {@code rows * cols}
     * @param rows the number of rows
     * @param cols the number of columns
     *
     * @return the grid
     *
     * @throws IllegalArgumentException if the text does not fill the grid exactly
     */
    public static Grid ofRows(CharSequence text, int rows, int cols) {
        if (rows < 0 || cols < 0 || text.length() != rows * cols) {
            throw new IllegalArgumentException(
                "Text of length " + text.length() + " does not fill a " + rows + "x" + cols +
                " grid");
        }
        return new Grid(rows, cols, text.toString().toCharArray());
    }

    /**
     * Pads {@code text} with {@link TextFilter#PAD_CHAR} to a whole number of rows and writes it
     * into a grid of {@code cols} columns.
     *
     * @param text the text
     * @param cols the number of columns, must be positive
     *
     * @return the grid, with as few rows as hold the text
     */
    public static Grid padded(String text, int cols) {
        String padded = TextFilter.pad(text, cols);
        return ofRows(padded, padded.length() / cols, cols);
    }

    /**
     * Builds the grid that {@link #read(CoordinateOrder)} with {@code order} would turn into
     * {@code text}: the characters of {@code text} are placed, in sequence, at the cells of
     * {@code order}.
     *
     * @param order the cell order
     * @param text  the text, of length {@code order.size()}
     *
     * @return the filled grid
     */
    public static Grid fill(CoordinateOrder order, CharSequence text) {
        if (text.length() != order.size()) {
            throw new IllegalArgumentException(
                "Text of length " + text.length() + " does not fill a " + order.rows() + "x" +
                order.cols() + " grid");
        }
        char[] cells = new char[order.size()];
        int k = 0;
        for (Coordinate c : order.coordinates()) {
            cells[c.row() * order.cols() + c.col()] = text.charAt(k++);
        }
        return new Grid(order.rows(), order.cols(), cells);
    }

    /**
     * Reads the cells in the given order.
     *
     * @param order an order over a grid of the same dimensions
     *
     * @return the characters in that order
     */
    public String read(CoordinateOrder order) {
        if (order.rows() != rows || order.cols() != cols) {
            throw new IllegalArgumentException(
                "A " + order.rows() + "x" + order.cols() + " order cannot read a " + rows + "x" +
                cols + " grid");
        }
        StringBuilder sb = new StringBuilder(cells.length);
        for (Coordinate c : order.coordinates()) {
            sb.append(get(c.row(), c.col()));
        }
        return sb.toString();
    }

    /**
     * Reads the grid row by row.
     *
     * @return the characters in row-major order
     */
    public String toRowMajorString() {
        return new String(cells);
    }

    public char get(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException(
                "(" + row + ", " + col + ") outside a " + rows + "x" + cols + " grid");
        }
        return cells[row * cols + col];
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(cells.length + rows);
        for (int r = 0; r < rows; r++) {
            if (r > 0) {
                sb.append('\n');
            }
            sb.append(cells, r * cols, cols);
        }
        return sb.toString();
    }

    private final int rows;
    private final int cols;
    private final char[] cells;
}
