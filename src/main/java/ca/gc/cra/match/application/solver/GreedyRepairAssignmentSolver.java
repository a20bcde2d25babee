package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.domain.match.SolverMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Approximate assignment for pools too large for the exact solver.
 * <p><strong>Why:</strong> Best-first greedy runs in roughly O(N K log N) on a blocked matrix; the row-order
 * pass adds O(N M) scoring but never needs the dense matrix the exact solver does.</p>
 * <p><strong>Thread-safety:</strong> Immutable configuration; each call keeps its state on the stack.</p>
 * <p><strong>Observability:</strong> Logs the greedy total, completion count and swap gains at DEBUG.</p>
 *
 * <p>Three phases:</p>
 * <ol>
 *   <li>Best-first greedy over the retained candidates, ordered by score descending then row and
 *       column ascending (rows and columns are in id order, so ties break by profile id then record id).</li>
 *   <li>Completion: rows still unmatched take their best free column, scored on demand.</li>
 *   <li>Repair: up to {@code repairPasses} passes of 2-opt moves within a window of {@code repairWindow}
 *       rows or free columns. A move is applied only when it raises the total by more than {@link #MIN_GAIN}.</li>
 * </ol>
 * <p>The row-order greedy assignment of {@link RowGreedyAssignmentSolver} is repaired the same way and
 * returned instead when its total is higher, so the result never scores below the baseline.</p>
 *
 * @since 0.1.0
 */
public final class GreedyRepairAssignmentSolver implements AssignmentSolver {
  private static final Logger log = LoggerFactory.getLogger(GreedyRepairAssignmentSolver.class);

  /** Smallest total-score improvement a repair move must achieve. */
  public static final double MIN_GAIN = 1e-12;

  private static final Comparator<Cursor> BEST_FIRST =
      Comparator.<Cursor>comparingDouble(Cursor::score).reversed()
          .thenComparingInt(Cursor::row)
          .thenComparingInt(Cursor::column);

  private final int repairPasses;
  private final int repairWindow;

  /**
   * Creates a solver.
   *
   * @param repairPasses maximum local-improvement passes; zero disables repair
   * @param repairWindow neighbours examined per row in each pass; must be positive
   */
  public GreedyRepairAssignmentSolver(int repairPasses, int repairWindow) {
    if (repairPasses < 0) {
      throw new IllegalArgumentException("repairPasses must not be negative");
    }
    if (repairWindow <= 0) {
      throw new IllegalArgumentException("repairWindow must be positive");
    }
    this.repairPasses = repairPasses;
    this.repairWindow = repairWindow;
  }

  @Override
  public SolverMode mode() {
    return SolverMode.HEURISTIC;
  }

  @Override
  public Assignment solve(CompatibilityMatrix matrix) {
    int rows = matrix.rows();
    int columns = matrix.columns();
    int[] columnForRow = new int[rows];
    int[] rowForColumn = new int[columns];
    Arrays.fill(columnForRow, Assignment.UNASSIGNED);
    Arrays.fill(rowForColumn, Assignment.UNASSIGNED);
    if (rows == 0 || columns == 0) {
      return new Assignment(SolverMode.HEURISTIC, columnForRow);
    }

    int target = Math.min(rows, columns);
    int matched = greedy(matrix, columnForRow, rowForColumn);
    int completed = complete(matrix, columnForRow, rowForColumn, target - matched);
    if (log.isDebugEnabled()) {
      log.debug("Greedy matched {} pairs, completion added {}", matched, completed);
    }
    repairAll(matrix, columnForRow, rowForColumn);

    // Row-order seed, repaired the same way; repair never lowers a total.
    int[] seeded = RowGreedyAssignmentSolver.columnsInRowOrder(matrix);
    repairAll(matrix, seeded, rowsFor(seeded, columns));
    double bestFirstTotal = total(matrix, columnForRow);
    double seededTotal = total(matrix, seeded);
    if (seededTotal - bestFirstTotal > MIN_GAIN) {
      log.debug("Row-order seed won: {} over {}", seededTotal, bestFirstTotal);
      return new Assignment(SolverMode.HEURISTIC, seeded);
    }
    return new Assignment(SolverMode.HEURISTIC, columnForRow);
  }

  private void repairAll(CompatibilityMatrix matrix, int[] columnForRow, int[] rowForColumn) {
    for (int pass = 0; pass < repairPasses; pass++) {
      double gain = repair(matrix, columnForRow, rowForColumn);
      log.debug("Repair pass {} gained {}", pass + 1, gain);
      if (gain == 0.0) {
        break;
      }
    }
  }

  private static int[] rowsFor(int[] columnForRow, int columns) {
    int[] rowForColumn = new int[columns];
    Arrays.fill(rowForColumn, Assignment.UNASSIGNED);
    for (int row = 0; row < columnForRow.length; row++) {
      if (columnForRow[row] != Assignment.UNASSIGNED) {
        rowForColumn[columnForRow[row]] = row;
      }
    }
    return rowForColumn;
  }

  private static double total(CompatibilityMatrix matrix, int[] columnForRow) {
    double sum = 0.0;
    for (int row = 0; row < columnForRow.length; row++) {
      sum += cell(matrix, row, columnForRow[row]);
    }
    return sum;
  }

  private static int greedy(CompatibilityMatrix matrix, int[] columnForRow, int[] rowForColumn) {
    PriorityQueue<Cursor> queue = new PriorityQueue<>(Math.max(1, matrix.rows()), BEST_FIRST);
    for (int row = 0; row < matrix.rows(); row++) {
      RowQueue candidates = RowQueue.of(matrix, row);
      if (candidates.hasNext()) {
        queue.add(candidates.next());
      }
    }
    int target = Math.min(matrix.rows(), matrix.columns());
    int matched = 0;
    while (!queue.isEmpty() && matched < target) {
      Cursor cursor = queue.poll();
      if (rowForColumn[cursor.column()] == Assignment.UNASSIGNED) {
        columnForRow[cursor.row()] = cursor.column();
        rowForColumn[cursor.column()] = cursor.row();
        matched++;
        continue;
      }
      // Column taken; the row retries with its next candidate.
      if (cursor.source().hasNext()) {
        queue.add(cursor.source().next());
      }
    }
    return matched;
  }

  private static int complete(
      CompatibilityMatrix matrix, int[] columnForRow, int[] rowForColumn, int missing) {
    int added = 0;
    for (int row = 0; row < matrix.rows() && added < missing; row++) {
      if (columnForRow[row] != Assignment.UNASSIGNED) {
        continue;
      }
      int best = Assignment.UNASSIGNED;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (int column = 0; column < matrix.columns(); column++) {
        if (rowForColumn[column] != Assignment.UNASSIGNED) {
          continue;
        }
        double score = matrix.score(row, column);
        if (score > bestScore) {
          bestScore = score;
          best = column;
        }
      }
      if (best == Assignment.UNASSIGNED) {
        break;
      }
      columnForRow[row] = best;
      rowForColumn[best] = row;
      added++;
    }
    return added;
  }

  private double repair(CompatibilityMatrix matrix, int[] columnForRow, int[] rowForColumn) {
    double gained = 0.0;
    int rows = matrix.rows();
    int columns = matrix.columns();
    for (int a = 0; a < rows; a++) {
      int ca = columnForRow[a];
      int limit = Math.min(rows, a + 1 + repairWindow);
      for (int b = a + 1; b < limit; b++) {
        int cb = columnForRow[b];
        if (ca == Assignment.UNASSIGNED && cb == Assignment.UNASSIGNED) {
          continue;
        }
        double before = cell(matrix, a, ca) + cell(matrix, b, cb);
        double after = cell(matrix, a, cb) + cell(matrix, b, ca);
        double gain = after - before;
        if (gain > MIN_GAIN) {
          assign(a, cb, columnForRow, rowForColumn);
          assign(b, ca, columnForRow, rowForColumn);
          ca = cb;
          gained += gain;
        }
      }
    }
    if (columns > rows) {
      gained += relocate(matrix, columnForRow, rowForColumn);
    }
    return gained;
  }

  // Moves matched rows onto better free columns when records outnumber profiles.
  private double relocate(CompatibilityMatrix matrix, int[] columnForRow, int[] rowForColumn) {
    List<Integer> free = new ArrayList<>();
    for (int column = 0; column < rowForColumn.length && free.size() < repairWindow; column++) {
      if (rowForColumn[column] == Assignment.UNASSIGNED) {
        free.add(column);
      }
    }
    double gained = 0.0;
    for (int row = 0; row < columnForRow.length; row++) {
      int current = columnForRow[row];
      if (current == Assignment.UNASSIGNED) {
        continue;
      }
      double currentScore = matrix.score(row, current);
      int bestSlot = -1;
      double bestGain = MIN_GAIN;
      for (int slot = 0; slot < free.size(); slot++) {
        double gain = matrix.score(row, free.get(slot)) - currentScore;
        if (gain > bestGain) {
          bestGain = gain;
          bestSlot = slot;
        }
      }
      if (bestSlot >= 0) {
        int target = free.get(bestSlot);
        rowForColumn[current] = Assignment.UNASSIGNED;
        assign(row, target, columnForRow, rowForColumn);
        free.set(bestSlot, current);
        gained += bestGain;
      }
    }
    return gained;
  }

  private static void assign(int row, int column, int[] columnForRow, int[] rowForColumn) {
    columnForRow[row] = column;
    if (column != Assignment.UNASSIGNED) {
      rowForColumn[column] = row;
    }
  }

  private static double cell(CompatibilityMatrix matrix, int row, int column) {
    return column == Assignment.UNASSIGNED ? 0.0 : matrix.score(row, column);
  }

  private record Cursor(int row, int column, double score, RowQueue source) {}

  /** Candidates of one row in best-first order. */
  private static final class RowQueue {
    private final int row;
    private final int[] columns;
    private final double[] scores;
    private int next;

    private RowQueue(int row, int[] columns, double[] scores) {
      this.row = row;
      this.columns = columns;
      this.scores = scores;
    }

    static RowQueue of(CompatibilityMatrix matrix, int row) {
      List<double[]> cells = new ArrayList<>();
      matrix.forEachCandidate(row, (column, score) -> cells.add(new double[] {column, score}));
      cells.sort((l, r) -> {
        int cmp = Double.compare(r[1], l[1]);
        return cmp != 0 ? cmp : Double.compare(l[0], r[0]);
      });
      int[] columns = new int[cells.size()];
      double[] scores = new double[cells.size()];
      for (int i = 0; i < cells.size(); i++) {
        columns[i] = (int) cells.get(i)[0];
        scores[i] = cells.get(i)[1];
      }
      return new RowQueue(row, columns, scores);
    }

    boolean hasNext() {
      return next < columns.length;
    }

    Cursor next() {
      Cursor cursor = new Cursor(row, columns[next], scores[next], this);
      next++;
      return cursor;
    }
  }
}
