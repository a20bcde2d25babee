package ca.gc.cra.match.domain.scoring;

import ca.gc.cra.match.domain.model.Ages;

/**
 * Tiered, monotonically non-increasing age proximity policy.
 * <ul>
 *   <li>exact match: 1.0</li>
 *   <li>gap of at most 2 years: 0.9</li>
 *   <li>gap of at most 5 years: 0.7</li>
 *   <li>otherwise {@code max(0, 1 - gap / 20)}</li>
 * </ul>
 * An unknown or implausible age on either side yields {@link #NEUTRAL}.
 *
 * @since 0.1.0
 */
public final class AgeScorePolicy {
  /** Sub-score substituted when either age is unusable. */
  public static final double NEUTRAL = 0.5;

  private static final int CLOSE_GAP = 2;
  private static final int NEAR_GAP = 5;
  private static final double DECAY_SPAN = 20.0;

  private AgeScorePolicy() {
    // Utility
  }

  /**
   * Scores the proximity of two ages.
   *
   * @param profileAge profile age; may be {@code null}
   * @param recordAge record age; may be {@code null}
   * @return score in {@code [0, 1]}
   */
  public static double score(Integer profileAge, Integer recordAge) {
    Integer gap = Ages.gap(profileAge, recordAge);
    if (gap == null) {
      return NEUTRAL;
    }
    return scoreGap(gap);
  }

  /**
   * Scores a known, non-negative age gap.
   *
   * @param gap absolute gap in years
   * @return score in {@code [0, 1]}
   */
  public static double scoreGap(int gap) {
    if (gap < 0) {
      throw new IllegalArgumentException("gap must not be negative (was " + gap + ")");
    }
    if (gap == 0) {
      return 1.0;
    }
    if (gap <= CLOSE_GAP) {
      return 0.9;
    }
    if (gap <= NEAR_GAP) {
      return 0.7;
    }
    return Math.max(0.0, 1.0 - gap / DECAY_SPAN);
  }
}
