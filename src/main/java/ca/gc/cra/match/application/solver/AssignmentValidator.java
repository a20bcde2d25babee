package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.domain.error.AssignmentInvariantException;

/**
 * Post-solve checks run on every assignment before it is reported.
 *
 * @since 0.1.0
 */
public final class AssignmentValidator {
  private AssignmentValidator() {
    // Utility
  }

  /**
   * Verifies that an assignment is one-to-one, in range, complete for the smaller side, and that every
   * matched score lies in {@code [0, 1]}.
   *
   * @param matrix matrix the assignment was solved on
   * @param assignment solver output
   * @throws AssignmentInvariantException on the first violation found
   */
  public static void validate(CompatibilityMatrix matrix, Assignment assignment) {
    int rows = matrix.rows();
    int columns = matrix.columns();
    if (assignment.rows() != rows) {
      throw new AssignmentInvariantException(
          "assignment covers " + assignment.rows() + " rows but matrix has " + rows);
    }
    boolean[] used = new boolean[columns];
    int pairs = 0;
    for (int row = 0; row < rows; row++) {
      int column = assignment.columnFor(row);
      if (column == Assignment.UNASSIGNED) {
        continue;
      }
      if (column < 0 || column >= columns) {
        throw new AssignmentInvariantException(
            "profile " + matrix.profiles().get(row).id() + " assigned to column " + column
                + " outside [0," + columns + ")");
      }
      if (used[column]) {
        throw new AssignmentInvariantException(
            "record " + matrix.records().get(column).id() + " assigned more than once");
      }
      used[column] = true;
      double score = matrix.score(row, column);
      if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
        throw new AssignmentInvariantException("pair " + matrix.profiles().get(row).id() + "/"
            + matrix.records().get(column).id() + " has score " + score + " outside [0,1]");
      }
      pairs++;
    }
    int expected = Math.min(rows, columns);
    if (pairs != expected) {
      throw new AssignmentInvariantException(
          "assignment has " + pairs + " pairs, expected " + expected);
    }
  }
}
