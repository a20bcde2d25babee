package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.domain.match.SolverMode;
import java.util.Arrays;
import java.util.Objects;

/**
 * Row-to-column assignment produced by an {@link AssignmentSolver}.
 * <p>Indices refer to the canonical rows and columns of the solved matrix; unmatched rows hold
 * {@link #UNASSIGNED}. Immutable.</p>
 *
 * @since 0.1.0
 */
public final class Assignment {
  /** Marker for a row without a column. */
  public static final int UNASSIGNED = -1;

  private final SolverMode mode;
  private final int[] columnForRow;

  /**
   * Creates an assignment.
   *
   * @param mode concrete solver mode that produced it; never {@link SolverMode#AUTO}
   * @param columnForRow column per row, or {@link #UNASSIGNED}; copied
   */
  public Assignment(SolverMode mode, int[] columnForRow) {
    this.mode = Objects.requireNonNull(mode, "mode");
    if (mode == SolverMode.AUTO) {
      throw new IllegalArgumentException("assignment must name a concrete solver mode");
    }
    this.columnForRow = Objects.requireNonNull(columnForRow, "columnForRow").clone();
  }

  public SolverMode mode() {
    return mode;
  }

  public int rows() {
    return columnForRow.length;
  }

  public int columnFor(int row) {
    return columnForRow[row];
  }

  /**
   * Counts assigned rows.
   *
   * @return number of pairs
   */
  public int pairCount() {
    int count = 0;
    for (int column : columnForRow) {
      if (column != UNASSIGNED) {
        count++;
      }
    }
    return count;
  }

  /**
   * Sums the matrix score of every assigned cell.
   *
   * @param matrix matrix the assignment was solved on
   * @return total score
   */
  public double totalScore(CompatibilityMatrix matrix) {
    double total = 0.0;
    for (int row = 0; row < columnForRow.length; row++) {
      if (columnForRow[row] != UNASSIGNED) {
        total += matrix.score(row, columnForRow[row]);
      }
    }
    return total;
  }

  @Override
  public String toString() {
    return "Assignment{mode=" + mode + ", columnForRow=" + Arrays.toString(columnForRow) + '}';
  }
}
