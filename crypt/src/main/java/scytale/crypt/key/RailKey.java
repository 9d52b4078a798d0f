package scytale.crypt.key;

/**
 * The number of rails of a Rail Fence cipher.
 *
 * @param rails the rail count; the cipher requires {@code 2 <= rails <= text length}
 */
public record RailKey(int rails) implements CipherKey {}
