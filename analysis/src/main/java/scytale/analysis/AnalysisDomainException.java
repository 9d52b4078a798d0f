package scytale.analysis;

import java.io.Serial;

/**
 * Thrown when an analysis is asked for with parameters outside its domain, such as an n-gram
 * size below one.
 */
public class AnalysisDomainException extends IllegalArgumentException {
  @Serial private static final long serialVersionUID = -1;

  public AnalysisDomainException(String message) {
    super(message);
  }
}
