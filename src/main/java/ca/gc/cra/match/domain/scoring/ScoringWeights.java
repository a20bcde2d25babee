package ca.gc.cra.match.domain.scoring;

/**
 * Relative weights of the age and socio-economic sub-scores in the composite score.
 *
 * @param age weight applied to the age sub-score, in {@code [0, 1]}
 * @param socio weight applied to the socio-economic sub-score, in {@code [0, 1]}
 * @since 0.1.0
 */
public record ScoringWeights(double age, double socio) {
  private static final double SUM_TOLERANCE = 1e-9;

  /**
   * Validates weight bounds and that the weights sum to one.
   *
   * @throws IllegalArgumentException if a weight is outside {@code [0, 1]} or the sum differs from one
   */
  public ScoringWeights {
    requireUnit("weights.age", age);
    requireUnit("weights.socio", socio);
    if (Math.abs(age + socio - 1.0) > SUM_TOLERANCE) {
      throw new IllegalArgumentException(
          "weights.age + weights.socio must equal 1 (was " + (age + socio) + ")");
    }
  }

  /**
   * Returns the default 0.6 / 0.4 split favouring age proximity.
   *
   * @return default weights
   */
  public static ScoringWeights defaults() {
    return new ScoringWeights(0.6, 0.4);
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be between 0 and 1 (was " + value + ")");
    }
  }
}
