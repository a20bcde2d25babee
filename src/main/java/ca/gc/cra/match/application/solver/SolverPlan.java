package ca.gc.cra.match.application.solver;

import ca.gc.cra.match.application.matrix.MatrixLayout;
import ca.gc.cra.match.domain.match.SolverMode;
import java.util.Objects;

/**
 * Concrete solver mode and the matrix layout it needs.
 *
 * @param mode resolved solver mode; never {@link SolverMode#AUTO}
 * @param layout matrix layout to build
 * @since 0.1.0
 */
public record SolverPlan(SolverMode mode, MatrixLayout layout) {
  public SolverPlan {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(layout, "layout");
    if (mode == SolverMode.AUTO) {
      throw new IllegalArgumentException("plan must name a concrete solver mode");
    }
  }
}
