package ca.gc.cra.match.domain.error;

/**
 * Raised when the compatibility matrix cannot be allocated or processed in the requested mode.
 * <p>Always fatal for the run; the engine never falls back to a cheaper representation on its own.</p>
 *
 * @since 0.1.0
 */
public final class MatrixCapacityException extends MatchingException {
  private static final long serialVersionUID = 1L;

  public MatrixCapacityException(String message) {
    super(message);
  }

  public MatrixCapacityException(String message, Throwable cause) {
    super(message, cause);
  }
}
