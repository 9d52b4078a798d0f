/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

/**
 * The rail pattern of the Rail Fence cipher: a pointer bounces between rail 0 and the last
 * rail, and each text position is written on the rail the pointer is on.
 */
public final class Zigzag {

    private Zigzag() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the rail of each text position.
     *
     * @param length the text length
     * @param rails  the number of rails, at least 2
     *
     * @return {@code rail[i]} for every position {@code i}
     */
    public static int[] railsOf(int length, int rails) {
        if (rails < 2) {
            throw new IllegalArgumentException("A zigzag needs at least 2 rails, got " + rails);
        }
        int[] out = new int[length];
        int rail = 0;
        int direction = 1;
        for (int i = 0; i < length; i++) {
            out[i] = rail;
            if (rail == 0) {
                direction = 1;
            } else if (rail == rails - 1) {
                direction = -1;
            }
            rail += direction;
        }
        return out;
    }

    /**
     * Returns the read-out order: the positions of rail 0 left to right, then those of rail 1,
     * and so on down to the last rail.
     *
     * @param length the text length
     * @param rails  the number of rails, at least 2
     *
     * @return the permutation that turns text into its rail fence read-out
     */
    public static Transposition readOrder(int length, int rails) {
        int[] railOf = railsOf(length, rails);
        int[] order = new int[length];
        int k = 0;
        for (int rail = 0; rail < rails; rail++) {
            for (int i = 0; i < length; i++) {
                if (railOf[i] == rail) {
                    order[k++] = i;
                }
            }
        }
        return new Transposition(order);
    }
}
