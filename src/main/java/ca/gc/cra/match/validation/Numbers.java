package ca.gc.cra.match.validation;

/**
 * Numeric range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a long value lies within an inclusive range.
   *
   * @param name label used in the error message
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the value
   * @throws IllegalArgumentException when outside the range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a double lies within {@code [0, 1]}.
   *
   * @param name label used in the error message
   * @param value value to check
   * @return the value
   * @throws IllegalArgumentException when NaN or outside the unit interval
   */
  public static double requireUnitInterval(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(label(name) + " must be within [0,1] (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
