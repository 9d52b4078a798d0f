module scytale.analysis {
  requires scytale.base;
  requires org.slf4j;

  exports scytale.analysis;
}
