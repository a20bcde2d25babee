package ca.gc.cra.match.domain.error;

/**
 * Base type for failures raised by the matching engine.
 * <p>Unchecked so pure domain code (scoring, solving) can fail fast without widening signatures;
 * the pipeline translates these into stage-aware failures.</p>
 *
 * @since 0.1.0
 */
public class MatchingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message human readable description of the fatal condition
   */
  public MatchingException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and cause.
   *
   * @param message human readable description of the fatal condition
   * @param cause underlying failure
   */
  public MatchingException(String message, Throwable cause) {
    super(message, cause);
  }
}
