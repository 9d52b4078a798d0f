module scytale.crypt {
  requires org.jspecify;
  requires scytale.base;
  requires org.slf4j;
  requires org.apache.commons.lang3;

  exports scytale.crypt;
  exports scytale.crypt.key;
  exports scytale.crypt.keystream;
  exports scytale.crypt.math;
  exports scytale.crypt.polygraphic;
  exports scytale.crypt.settings;
  exports scytale.crypt.substitution;
  exports scytale.crypt.transposition;
}
