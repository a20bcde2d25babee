package ca.gc.cra.match.domain.match;

import java.util.Locale;

/**
 * Assignment strategy requested for, or used by, a matching run.
 *
 * @since 0.1.0
 */
public enum SolverMode {
  /** Pick {@link #EXACT} or {@link #HEURISTIC} from pool sizes. */
  AUTO,
  /** Kuhn-Munkres optimal assignment over a dense matrix. */
  EXACT,
  /** Greedy selection with bounded swap repair over a blocked candidate matrix. */
  HEURISTIC,
  /** Naive row-by-row greedy; reference baseline. */
  BASELINE;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw mode text; blank selects {@link #AUTO}
   * @return parsed mode
   * @throws IllegalArgumentException when the text names no mode
   */
  public static SolverMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return AUTO;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "solverMode must be one of AUTO, EXACT, HEURISTIC, BASELINE (was " + raw + ")", ex);
    }
  }
}
