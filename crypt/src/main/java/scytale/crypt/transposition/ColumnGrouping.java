/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The column order of the Myszkowski transposition. Columns are grouped by their key letter;
 * groups are taken in ascending letter order, columns within a group left to right, and each
 * column is read top to bottom before the next one.
 */
public final class ColumnGrouping {

    private ColumnGrouping() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Groups column indexes by key character.
     *
     * @param key the column key; case is ignored
     *
     * @return the column indexes of each key character, in ascending character order
     */
    public static SortedMap<Character, List<Integer>> groups(String key) {
        String upper = key.toUpperCase(Locale.ROOT);
        SortedMap<Character, List<Integer>> groups = new TreeMap<>();
        for (int col = 0; col < upper.length(); col++) {
            groups.computeIfAbsent(upper.charAt(col), c -> new ArrayList<>()).add(col);
        }
        return groups;
    }

    /**
     * Returns the read-out order over a grid with one column per key character.
     *
     * @param key  the column key
     * @param rows the number of grid rows
     *
     * @return the order
     */
    public static CoordinateOrder order(String key, int rows) {
        List<Coordinate> out = new ArrayList<>(rows * key.length());
        for (Map.Entry<Character, List<Integer>> group : groups(key).entrySet()) {
            for (int col : group.getValue()) {
                for (int row = 0; row < rows; row++) {
                    out.add(new Coordinate(row, col));
                }
            }
        }
        return new CoordinateOrder(rows, key.length(), out);
    }
}
