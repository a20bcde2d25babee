package ca.gc.cra.match.domain.scoring;

import ca.gc.cra.match.domain.error.ScoreOutOfRangeException;
import ca.gc.cra.match.domain.model.Ages;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.DemographicDimension;
import ca.gc.cra.match.domain.model.Demographics;
import ca.gc.cra.match.domain.model.Profile;
import java.util.Objects;

/**
 * <strong>What:</strong> Computes the compatibility of one profile with one clinical record.
 * <p><strong>Why:</strong> Feeds the compatibility matrix that the assignment solvers optimize.</p>
 * <p><strong>Role:</strong> Pure domain service; the output depends only on the two inputs and the weights.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across scoring workers.</p>
 * <p><strong>Performance:</strong> Constant time per pair.</p>
 *
 * <p>Composite = {@code w_age * age + w_socio * socio}. The socio sub-score averages the
 * {@link CategoryScale} similarity of every dimension present on both sides; dimensions missing on
 * either side are excluded rather than scored as zero, and when no dimension is comparable the socio
 * sub-score is the neutral 0.5.</p>
 *
 * @since 0.1.0
 */
public final class CompatibilityScorer {
  /** Socio sub-score used when no dimension is present on both sides. */
  public static final double NEUTRAL_SOCIO = 0.5;

  private static final DemographicDimension[] DIMENSIONS = DemographicDimension.values();

  private final ScoringWeights weights;

  /**
   * Creates a scorer with explicit weights.
   *
   * @param weights validated weights; must not be {@code null}
   */
  public CompatibilityScorer(ScoringWeights weights) {
    this.weights = Objects.requireNonNull(weights, "weights");
  }

  /**
   * Creates a scorer with the default 0.6 / 0.4 weights.
   */
  public CompatibilityScorer() {
    this(ScoringWeights.defaults());
  }

  public ScoringWeights weights() {
    return weights;
  }

  /**
   * Scores a pair and returns the full breakdown.
   *
   * @param profile profile side; must not be {@code null}
   * @param record record side; must not be {@code null}
   * @return composite and sub-scores
   * @throws ScoreOutOfRangeException if any derived score leaves {@code [0, 1]}
   */
  public CompatibilityScore score(Profile profile, ClinicalRecord record) {
    double age = AgeScorePolicy.score(profile.age(), record.age());
    Demographics left = profile.demographics();
    Demographics right = record.demographics();
    double sum = 0.0;
    int compared = 0;
    for (DemographicDimension dimension : DIMENSIONS) {
      String l = left.valueOf(dimension).orElse(null);
      String r = right.valueOf(dimension).orElse(null);
      if (l == null || r == null) {
        continue;
      }
      sum += CategoryScale.forDimension(dimension).similarity(l, r);
      compared++;
    }
    double socio = compared == 0 ? NEUTRAL_SOCIO : sum / compared;
    double composite = combine(age, socio);
    requireUnit("age", age, profile, record);
    requireUnit("socio", socio, profile, record);
    requireUnit("composite", composite, profile, record);
    boolean neutralAge = !Ages.isPlausible(profile.age()) || !Ages.isPlausible(record.age());
    return new CompatibilityScore(composite, age, socio, compared, neutralAge);
  }

  /**
   * Scores a pair returning only the composite; used when filling the matrix.
   *
   * @param profile profile side
   * @param record record side
   * @return composite score in {@code [0, 1]}
   * @throws ScoreOutOfRangeException if the composite leaves {@code [0, 1]}
   */
  public double composite(Profile profile, ClinicalRecord record) {
    return score(profile, record).composite();
  }

  private double combine(double age, double socio) {
    // convex form keeps 1.0 exact when both sub-scores are 1.0
    return socio + weights.age() * (age - socio);
  }

  private static void requireUnit(String label, double value, Profile profile, ClinicalRecord record) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new ScoreOutOfRangeException(label + " score " + value + " outside [0,1] for profile "
          + profile.id() + " and record " + record.id());
    }
  }
}
