module scytale.base {
  requires org.apache.commons.lang3;

  exports scytale.base;
}
