package ca.gc.cra.match.domain.error;

/**
 * Signals a solver defect: an assignment reused a profile or record, referenced an index outside
 * the matrix, or left the smaller side partially unmatched.
 *
 * @since 0.1.0
 */
public final class AssignmentInvariantException extends MatchingException {
  private static final long serialVersionUID = 1L;

  public AssignmentInvariantException(String message) {
    super(message);
  }
}
