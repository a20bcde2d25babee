package ca.gc.cra.match.domain.match;

import java.util.Locale;

/**
 * Bucketed classification of a matched pair's composite score.
 * <p>Thresholds are fixed: excellent {@code >= 0.85}, good {@code >= 0.75}, fair {@code >= 0.65},
 * poor below.</p>
 *
 * @since 0.1.0
 */
public enum QualityTier {
  EXCELLENT(0.85),
  GOOD(0.75),
  FAIR(0.65),
  POOR(Double.NEGATIVE_INFINITY);

  private final double lowerBound;

  QualityTier(double lowerBound) {
    this.lowerBound = lowerBound;
  }

  /**
   * Classifies a composite score.
   *
   * @param score composite score in {@code [0, 1]}
   * @return first tier whose lower bound the score reaches
   */
  public static QualityTier of(double score) {
    for (QualityTier tier : values()) {
      if (score >= tier.lowerBound) {
        return tier;
      }
    }
    return POOR;
  }

  /**
   * Returns the lowercase label written to the artifact.
   *
   * @return label such as {@code excellent}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
