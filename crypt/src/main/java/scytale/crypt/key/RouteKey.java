package scytale.crypt.key;

import java.util.Objects;
import scytale.crypt.transposition.RoutePattern;

/**
 * The grid geometry and read-out route of a Route cipher.
 *
 * @param rows the number of grid rows
 * @param cols the number of grid columns
 * @param pattern the order in which the grid is read on encryption
 */
public record RouteKey(int rows, int cols, RoutePattern pattern) implements CipherKey {
  public RouteKey {
    Objects.requireNonNull(pattern, "pattern");
  }

  /**
   * Creates a key using the {@link RoutePattern#SPIRAL_IN} route.
   *
   * @param rows the number of grid rows
   * @param cols the number of grid columns
   */
  public RouteKey(int rows, int cols) {
    this(rows, cols, RoutePattern.SPIRAL_IN);
  }

  /**
   * Returns the number of cells of the grid.
   *
   * @return {@code rows * cols}
   */
  public long cells() {
    return (long) rows * cols;
  }
}
