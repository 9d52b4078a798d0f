package scytale.crypt.key;

/** The key of ciphers that take none, such as Atbash. */
public record EmptyKey() implements CipherKey {
  /** The only instance anybody needs. */
  public static final EmptyKey INSTANCE = new EmptyKey();
}
