package scytale.crypt.key;

/**
 * The key material of a classical cipher. Each implementation is one variant of the key shapes
 * the ciphers accept; which cipher accepts which variant is recorded in {@link
 * scytale.crypt.CipherType#keyClass}.
 *
 * <p>Keys are immutable values. Structural checks (non-null fields, square matrices) happen on
 * construction; whether a key is usable by a particular cipher is decided by that cipher.
 */
public interface CipherKey {}
