package ca.gc.cra.match.application.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.match.application.matrix.MatrixLayout;
import ca.gc.cra.match.domain.error.MatrixCapacityException;
import ca.gc.cra.match.domain.match.SolverMode;
import org.junit.jupiter.api.Test;

class SolverSelectorTest {
  private final SolverSelector selector = new SolverSelector(100, 1_000_000L, 2, 64);

  @Test
  void autoSwitchesOnExactThreshold() {
    assertEquals(new SolverPlan(SolverMode.EXACT, MatrixLayout.DENSE), selector.plan(SolverMode.AUTO, 100, 80));
    assertEquals(new SolverPlan(SolverMode.HEURISTIC, MatrixLayout.BLOCKED),
        selector.plan(SolverMode.AUTO, 80, 101));
  }

  @Test
  void autoFallsBackToHeuristicWhenDenseDoesNotFit() {
    SolverSelector tight = new SolverSelector(100, 50L, 2, 64);

    assertEquals(SolverMode.HEURISTIC, tight.plan(SolverMode.AUTO, 10, 10).mode());
  }

  @Test
  void explicitExactOverCapacityFails() {
    SolverSelector tight = new SolverSelector(100, 50L, 2, 64);

    assertThrows(MatrixCapacityException.class, () -> tight.plan(SolverMode.EXACT, 10, 10));
  }

  @Test
  void baselineUsesDenseWhenItFits() {
    assertEquals(MatrixLayout.DENSE, selector.plan(SolverMode.BASELINE, 10, 10).layout());
    assertEquals(MatrixLayout.BLOCKED, new SolverSelector(100, 50L, 2, 64)
        .plan(SolverMode.BASELINE, 10, 10).layout());
    assertEquals(MatrixLayout.BLOCKED, selector.plan(SolverMode.HEURISTIC, 2, 2).layout());
  }

  @Test
  void solverForResolvesConcreteModes() {
    assertInstanceOf(HungarianAssignmentSolver.class, selector.solverFor(SolverMode.EXACT));
    assertInstanceOf(GreedyRepairAssignmentSolver.class, selector.solverFor(SolverMode.HEURISTIC));
    assertInstanceOf(RowGreedyAssignmentSolver.class, selector.solverFor(SolverMode.BASELINE));
    assertThrows(IllegalArgumentException.class, () -> selector.solverFor(SolverMode.AUTO));
  }
}
