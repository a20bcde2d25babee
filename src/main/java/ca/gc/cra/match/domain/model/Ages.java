package ca.gc.cra.match.domain.model;

/**
 * Plausibility bounds for ages carried by profiles and records.
 *
 * @since 0.1.0
 */
public final class Ages {
  /** Lowest plausible age, inclusive. */
  public static final int MIN_PLAUSIBLE = 0;
  /** Highest plausible age, inclusive. */
  public static final int MAX_PLAUSIBLE = 120;

  private Ages() {
    // Utility
  }

  /**
   * Checks whether an age is usable for age scoring.
   *
   * @param age candidate age; may be {@code null}
   * @return {@code true} when present and inside {@code [MIN_PLAUSIBLE, MAX_PLAUSIBLE]}
   */
  public static boolean isPlausible(Integer age) {
    return age != null && age >= MIN_PLAUSIBLE && age <= MAX_PLAUSIBLE;
  }

  /**
   * Absolute age gap between two plausible ages.
   *
   * @param first first age
   * @param second second age
   * @return gap in years, or {@code null} when either side is not plausible
   */
  public static Integer gap(Integer first, Integer second) {
    if (!isPlausible(first) || !isPlausible(second)) {
      return null;
    }
    return Math.abs(first - second);
  }
}
