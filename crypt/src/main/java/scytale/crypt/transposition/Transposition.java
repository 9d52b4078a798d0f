/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import java.util.Arrays;

/**
 * A permutation of text positions. {@link #apply(CharSequence)} reads the input in the
 * permutation's order; {@link #invert(CharSequence)} writes the input back to the positions it
 * was read from, so {@code invert(apply(s)).equals(s)} for every {@code s} of matching length.
 */
public final class Transposition {

    /**
     * Creates a permutation.
     *
     * @param order {@code order[k]} is the input position that becomes output position
     *              {@code k}
     *
     * @throws IllegalArgumentException if {@code order} is not a permutation of
     *                                  {@code 0..order.length-1}
     */
    public Transposition(int[] order) {
        boolean[] seen = new boolean[order.length];
        for (int index : order) {
            if (index < 0 || index >= order.length || seen[index]) {
                throw new IllegalArgumentException(
                    "Not a permutation of 0.." + (order.length - 1) + ": " +
                    Arrays.toString(order));
            }
            seen[index] = true;
        }
        this.order = order.clone();
    }

    /**
     * Permutes {@code text}: output position {@code k} receives input position
     * {@code order[k]}.
     *
     * @param text the text, of length {@link #size()}
     *
     * @return the permuted text
     */
    public String apply(CharSequence text) {
        checkLength(text);
        char[] out = new char[order.length];
        for (int k = 0; k < order.length; k++) {
            out[k] = text.charAt(order[k]);
        }
        return new String(out);
    }

    /**
     * Undoes {@link #apply(CharSequence)}: input position {@code k} goes to output position
     * {@code order[k]}.
     *
     * @param text the permuted text, of length {@link #size()}
     *
     * @return the text in its original order
     */
    public String invert(CharSequence text) {
        checkLength(text);
        char[] out = new char[order.length];
        for (int k = 0; k < order.length; k++) {
            out[order[k]] = text.charAt(k);
        }
        return new String(out);
    }

    /**
     * Returns the permutation that undoes this one.
     *
     * @return the inverse permutation
     */
    public Transposition inverse() {
        int[] inverse = new int[order.length];
        for (int k = 0; k < order.length; k++) {
            inverse[order[k]] = k;
        }
        return new Transposition(inverse);
    }

    public int size() {
        return order.length;
    }

    /**
     * Returns the input position read at output position {@code k}.
     *
     * @param k the output position
     *
     * @return the input position
     */
    public int sourceOf(int k) {
        return order[k];
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Transposition other && Arrays.equals(order, other.order));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(order);
    }

    @Override
    public String toString() {
        return Arrays.toString(order);
    }

    private void checkLength(CharSequence text) {
        if (text.length() != order.length) {
            throw new IllegalArgumentException(
                "Text of length " + text.length() + " does not fit a permutation of " +
                order.length);
        }
    }

    private final int[] order;
}
