package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.MatrixBuilder;
import ca.gc.cra.match.application.matrix.MatrixLayout;
import ca.gc.cra.match.domain.error.MatrixCapacityException;
import ca.gc.cra.match.domain.match.SolverMode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the requested {@link SolverMode} into a {@link SolverPlan} and hands out the matching solver.
 * <p>AUTO picks EXACT when {@code max(rows, columns) <= exactThreshold} and the dense matrix fits
 * {@code maxDenseCells}, otherwise HEURISTIC. An explicit EXACT request that does not fit fails with
 * {@link MatrixCapacityException}; it is never downgraded.</p>
 *
 * @since 0.1.0
 */
public final class SolverSelector {
  private static final Logger log = LoggerFactory.getLogger(SolverSelector.class);

  private final int exactThreshold;
  private final long maxDenseCells;
  private final int repairPasses;
  private final int repairWindow;

  /**
   * Creates a selector.
   *
   * @param exactThreshold largest pool side AUTO still solves exactly
   * @param maxDenseCells dense matrix cell budget
   * @param repairPasses heuristic repair passes
   * @param repairWindow heuristic repair window
   */
  public SolverSelector(int exactThreshold, long maxDenseCells, int repairPasses, int repairWindow) {
    if (exactThreshold < 0) {
      throw new IllegalArgumentException("exactThreshold must not be negative");
    }
    if (maxDenseCells <= 0) {
      throw new IllegalArgumentException("maxDenseCells must be positive");
    }
    this.exactThreshold = exactThreshold;
    this.maxDenseCells = maxDenseCells;
    this.repairPasses = repairPasses;
    this.repairWindow = repairWindow;
  }

  /**
   * Resolves a plan for the given pool sizes.
   *
   * @param requested requested mode
   * @param rows profile count
   * @param columns record count
   * @return concrete plan
   * @throws MatrixCapacityException if EXACT is requested for a matrix beyond the dense budget
   */
  public SolverPlan plan(SolverMode requested, int rows, int columns) {
    Objects.requireNonNull(requested, "requested");
    boolean denseFits = (long) rows * columns <= maxDenseCells;
    SolverPlan plan;
    switch (requested) {
      case EXACT -> {
        MatrixBuilder.requireDenseCapacity(rows, columns, maxDenseCells);
        plan = new SolverPlan(SolverMode.EXACT, MatrixLayout.DENSE);
      }
      case HEURISTIC -> plan = new SolverPlan(SolverMode.HEURISTIC, MatrixLayout.BLOCKED);
      case BASELINE -> plan = new SolverPlan(
          SolverMode.BASELINE, denseFits ? MatrixLayout.DENSE : MatrixLayout.BLOCKED);
      case AUTO -> {
        boolean exact = Math.max(rows, columns) <= exactThreshold && denseFits;
        plan = exact
            ? new SolverPlan(SolverMode.EXACT, MatrixLayout.DENSE)
            : new SolverPlan(SolverMode.HEURISTIC, MatrixLayout.BLOCKED);
        log.info("AUTO selected {} for {} profiles x {} records (exactThreshold={}, maxDenseCells={})",
            plan.mode(), rows, columns, exactThreshold, maxDenseCells);
      }
      default -> throw new IllegalArgumentException("Unsupported solver mode: " + requested);
    }
    return plan;
  }

  /**
   * Returns the solver for a concrete mode.
   *
   * @param mode resolved mode
   * @return solver instance
   */
  public AssignmentSolver solverFor(SolverMode mode) {
    return switch (mode) {
      case EXACT -> new HungarianAssignmentSolver();
      case HEURISTIC -> new GreedyRepairAssignmentSolver(repairPasses, repairWindow);
      case BASELINE -> new RowGreedyAssignmentSolver();
      case AUTO -> throw new IllegalArgumentException("AUTO must be resolved through plan() first");
    };
  }
}
