package ca.gc.cra.match.domain.error;

/**
 * Raised when a profile or record collection cannot be loaded into the model (malformed JSON,
 * missing or duplicate identifiers, wrong top-level shape).
 *
 * @since 0.1.0
 */
public final class InvalidInputException extends MatchingException {
  private static final long serialVersionUID = 1L;

  public InvalidInputException(String message) {
    super(message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
