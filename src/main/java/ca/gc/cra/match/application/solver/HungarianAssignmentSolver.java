package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.application.matrix.MatrixLayout;
import ca.gc.cra.match.domain.error.AssignmentInvariantException;
import ca.gc.cra.match.domain.match.SolverMode;
import java.util.Arrays;

/**
 * <strong>What:</strong> Optimal assignment via the shortest-augmenting-path Hungarian algorithm.
 * <p><strong>Why:</strong> Maximizes the total compatibility score, which greedy strategies do not guarantee.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call allocates its own potentials.</p>
 * <p><strong>Performance:</strong> O(n<sup>2</sup> m) time and O(m) extra memory where n = min(rows, columns).</p>
 *
 * <p>Minimizes {@code 1 - score}. When there are more rows than columns the matrix is solved transposed,
 * so the smaller side is always fully matched. Columns are scanned in ascending order and the first
 * minimum wins, which keeps the result stable between runs.</p>
 *
 * @since 0.1.0
 */
public final class HungarianAssignmentSolver implements AssignmentSolver {

  @Override
  public SolverMode mode() {
    return SolverMode.EXACT;
  }

  @Override
  public Assignment solve(CompatibilityMatrix matrix) {
    if (matrix.layout() != MatrixLayout.DENSE) {
      throw new IllegalArgumentException("exact solving requires a dense matrix");
    }
    int rows = matrix.rows();
    int columns = matrix.columns();
    int[] columnForRow = new int[rows];
    Arrays.fill(columnForRow, Assignment.UNASSIGNED);
    if (rows == 0 || columns == 0) {
      return new Assignment(SolverMode.EXACT, columnForRow);
    }

    boolean transposed = rows > columns;
    int n = transposed ? columns : rows;
    int m = transposed ? rows : columns;
    CostFunction cost = transposed
        ? (i, j) -> 1.0 - matrix.score(j, i)
        : (i, j) -> 1.0 - matrix.score(i, j);

    int[] owner = minimize(n, m, cost);
    for (int j = 1; j <= m; j++) {
      if (owner[j] == 0) {
        continue;
      }
      int i = owner[j] - 1;
      if (transposed) {
        columnForRow[j - 1] = i;
      } else {
        columnForRow[i] = j - 1;
      }
    }
    return new Assignment(SolverMode.EXACT, columnForRow);
  }

  /**
   * Runs the O(n^2 m) potentials method on an n x m cost matrix with n <= m.
   *
   * @return 1-based owner row per 1-based column, 0 when the column is free
   */
  private static int[] minimize(int n, int m, CostFunction cost) {
    double[] u = new double[n + 1];
    double[] v = new double[m + 1];
    int[] owner = new int[m + 1];
    int[] way = new int[m + 1];
    double[] minv = new double[m + 1];
    boolean[] used = new boolean[m + 1];

    for (int i = 1; i <= n; i++) {
      owner[0] = i;
      int j0 = 0;
      Arrays.fill(minv, Double.POSITIVE_INFINITY);
      Arrays.fill(used, false);
      do {
        used[j0] = true;
        int i0 = owner[j0];
        double delta = Double.POSITIVE_INFINITY;
        int j1 = 0;
        for (int j = 1; j <= m; j++) {
          if (used[j]) {
            continue;
          }
          double reduced = cost.at(i0 - 1, j - 1) - u[i0] - v[j];
          if (reduced < minv[j]) {
            minv[j] = reduced;
            way[j] = j0;
          }
          if (minv[j] < delta) {
            delta = minv[j];
            j1 = j;
          }
        }
        if (j1 == 0) {
          throw new AssignmentInvariantException("no augmenting column found for row " + (i - 1));
        }
        for (int j = 0; j <= m; j++) {
          if (used[j]) {
            u[owner[j]] += delta;
            v[j] -= delta;
          } else {
            minv[j] -= delta;
          }
        }
        j0 = j1;
      } while (owner[j0] != 0);
      do {
        int j1 = way[j0];
        owner[j0] = owner[j1];
        j0 = j1;
      } while (j0 != 0);
    }
    return owner;
  }

  @FunctionalInterface
  private interface CostFunction {
    double at(int row, int column);
  }
}
