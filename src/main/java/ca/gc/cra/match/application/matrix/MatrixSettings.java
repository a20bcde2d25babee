package ca.gc.cra.match.application.matrix;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing knobs for matrix construction.
 *
 * @param maxDenseCells largest cell count a dense matrix may allocate
 * @param candidatesPerRow candidates retained per row in the blocked layout
 * @param candidateFloor minimum score a blocked candidate must reach
 * @param workers number of scoring tasks that may run in parallel
 * @param timeout wall-clock budget for scoring; {@link Duration#ZERO} disables it
 * @since 0.1.0
 */
public record MatrixSettings(
    long maxDenseCells, int candidatesPerRow, double candidateFloor, int workers, Duration timeout) {

  public MatrixSettings {
    if (maxDenseCells <= 0) {
      throw new IllegalArgumentException("maxDenseCells must be positive");
    }
    if (candidatesPerRow <= 0) {
      throw new IllegalArgumentException("candidatesPerRow must be positive");
    }
    if (Double.isNaN(candidateFloor) || candidateFloor < 0.0 || candidateFloor > 1.0) {
      throw new IllegalArgumentException("candidateFloor must be within [0,1]");
    }
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
  }

  /**
   * Defaults matching the shipped configuration.
   *
   * @return default settings
   */
  public static MatrixSettings defaults() {
    return new MatrixSettings(
        25_000_000L, 64, 0.0, Math.max(1, Runtime.getRuntime().availableProcessors()), Duration.ZERO);
  }
}
