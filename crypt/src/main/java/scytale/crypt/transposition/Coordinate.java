/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

/**
 * A cell of a grid.
 *
 * @param row the zero-based row
 * @param col the zero-based column
 */
public record Coordinate(int row, int col) {
    public Coordinate {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Negative coordinate (" + row + ", " + col + ")");
        }
    }
}
