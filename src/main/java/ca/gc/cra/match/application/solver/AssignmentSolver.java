package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.domain.match.SolverMode;

/**
 * Strategy that turns a compatibility matrix into a one-to-one assignment.
 * <p>Implementations match {@code min(rows, columns)} pairs, never reuse a row or column, and are
 * deterministic for a given matrix.</p>
 *
 * @since 0.1.0
 */
public interface AssignmentSolver {
  /**
   * Concrete mode recorded in the run artifact.
   *
   * @return solver mode; never {@link SolverMode#AUTO}
   */
  SolverMode mode();

  /**
   * Solves the assignment problem.
   *
   * @param matrix populated, unreleased matrix
   * @return assignment over the matrix's canonical indices
   */
  Assignment solve(CompatibilityMatrix matrix);
}
