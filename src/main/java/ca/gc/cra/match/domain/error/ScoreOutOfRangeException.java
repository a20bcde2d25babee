package ca.gc.cra.match.domain.error;

/**
 * Signals a scorer defect: a derived score fell outside {@code [0, 1]} or was not a number.
 * <p>Scores are never clamped after the fact.</p>
 *
 * @since 0.1.0
 */
public final class ScoreOutOfRangeException extends MatchingException {
  private static final long serialVersionUID = 1L;

  public ScoreOutOfRangeException(String message) {
    super(message);
  }
}
