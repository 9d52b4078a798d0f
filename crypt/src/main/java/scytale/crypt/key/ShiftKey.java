package scytale.crypt.key;

/**
 * A single integer shift: the fixed shift of the Caesar cipher, or the initial shift of the
 * August cipher. Any integer is accepted; it is reduced modulo 26 when used.
 *
 * @param shift the shift
 */
public record ShiftKey(int shift) implements CipherKey {
  /** The August cipher's initial shift when none is configured. */
  public static final int DEFAULT_AUGUST_SHIFT = 1;
}
