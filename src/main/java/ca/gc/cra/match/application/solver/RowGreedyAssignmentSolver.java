package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.domain.match.SolverMode;
import java.util.Arrays;

/**
 * Row-by-row greedy assignment: each profile in canonical order takes its best still-free record.
 * <p>Ties go to the lower column. Not optimal; kept as an explicit mode and as the reference the other
 * strategies are measured against.</p>
 *
 * @since 0.1.0
 */
public final class RowGreedyAssignmentSolver implements AssignmentSolver {

  @Override
  public SolverMode mode() {
    return SolverMode.BASELINE;
  }

  @Override
  public Assignment solve(CompatibilityMatrix matrix) {
    return new Assignment(SolverMode.BASELINE, columnsInRowOrder(matrix));
  }

  /**
   * Runs the row-by-row greedy pass.
   *
   * @param matrix matrix to solve
   * @return column per row, or {@link Assignment#UNASSIGNED}
   */
  static int[] columnsInRowOrder(CompatibilityMatrix matrix) {
    int rows = matrix.rows();
    int columns = matrix.columns();
    int[] columnForRow = new int[rows];
    Arrays.fill(columnForRow, Assignment.UNASSIGNED);
    boolean[] taken = new boolean[columns];
    int free = columns;
    for (int row = 0; row < rows && free > 0; row++) {
      int best = Assignment.UNASSIGNED;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int column = 0; column < columns; column++) {
        if (taken[column]) {
          continue;
        }
        double score = matrix.score(row, column);
        if (score > bestScore) {
          bestScore = score;
          best = column;
        }
      }
      columnForRow[row] = best;
      taken[best] = true;
      free--;
    }
    return columnForRow;
  }
}
