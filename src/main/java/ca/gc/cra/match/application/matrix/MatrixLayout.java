package ca.gc.cra.match.application.matrix;

/**
 * Storage layout of a {@link CompatibilityMatrix}.
 *
 * @since 0.1.0
 */
public enum MatrixLayout {
  /** Every cell materialized, row-major; memory O(N x M). */
  DENSE,
  /** Top candidates per row kept, other cells scored on demand; memory O(N x K). */
  BLOCKED
}
