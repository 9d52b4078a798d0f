/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.transposition;

import scytale.crypt.InvalidCipherParameterException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The routes along which the Route cipher reads its grid.
 */
public enum RoutePattern {
    /**
     * {@link CoordinateOrder#spiralIn(int, int)}
     */
    SPIRAL_IN("spiral_in"),

    /**
     * {@link CoordinateOrder#spiralOut(int, int)}
     */
    SPIRAL_OUT("spiral_out"),

    /**
     * {@link CoordinateOrder#snake(int, int)}
     */
    SNAKE("snake"),

    /**
     * {@link CoordinateOrder#diagonal(int, int)}
     */
    DIAGONAL("diagonal");

    /**
     * The name the pattern is configured by.
     */
    public final String patternName;

    RoutePattern(String patternName) {
        this.patternName = patternName;
    }

    /**
     * Generates this route over a grid.
     *
     * @param rows the number of grid rows
     * @param cols the number of grid columns
     *
     * @return the cell order
     */
    public CoordinateOrder order(int rows, int cols) {
        return switch (this) {
            case SPIRAL_IN -> CoordinateOrder.spiralIn(rows, cols);
            case SPIRAL_OUT -> CoordinateOrder.spiralOut(rows, cols);
            case SNAKE -> CoordinateOrder.snake(rows, cols);
            case DIAGONAL -> CoordinateOrder.diagonal(rows, cols);
        };
    }

    /**
     * Looks up a pattern by its {@link #patternName}, ignoring case; {@code '-'} is accepted
     * for {@code '_'}.
     *
     * @param name the pattern name, such as {@code "spiral_in"}
     *
     * @return the pattern
     *
     * @throws InvalidCipherParameterException if no pattern has that name
     */
    public static RoutePattern fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (RoutePattern pattern : values()) {
            if (pattern.patternName.equals(normalized)) {
                return pattern;
            }
        }
        throw new InvalidCipherParameterException(
            "Invalid pattern \"" + name + "\". Choose from: " +
            Arrays.stream(values()).map(p -> p.patternName).collect(Collectors.joining(", ")));
    }
}
