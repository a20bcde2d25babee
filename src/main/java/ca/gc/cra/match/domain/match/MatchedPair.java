package ca.gc.cra.match.domain.match;

import ca.gc.cra.match.domain.model.Ages;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import ca.gc.cra.match.domain.scoring.CompatibilityScore;
import java.util.Objects;

/**
 * <strong>What:</strong> One profile/record pair selected by the assignment solver.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param profileId profile identifier
 * @param recordId record identifier
 * @param score composite score in {@code [0, 1]}
 * @param ageScore age sub-score
 * @param socioScore socio-economic sub-score
 * @param tier quality tier derived from {@code score}
 * @param ageGap absolute age gap in years; {@code null} when either age is unknown
 * @since 0.1.0
 */
public record MatchedPair(
    String profileId,
    String recordId,
    double score,
    double ageScore,
    double socioScore,
    QualityTier tier,
    Integer ageGap) {

  public MatchedPair {
    Objects.requireNonNull(profileId, "profileId");
    Objects.requireNonNull(recordId, "recordId");
    Objects.requireNonNull(tier, "tier");
  }

  /**
   * Builds a pair from its inputs and their score breakdown.
   *
   * @param profile matched profile
   * @param record matched record
   * @param score score breakdown for the two
   * @return matched pair with its tier assigned
   */
  public static MatchedPair of(Profile profile, ClinicalRecord record, CompatibilityScore score) {
    return new MatchedPair(
        profile.id(),
        record.id(),
        score.composite(),
        score.age(),
        score.socio(),
        QualityTier.of(score.composite()),
        Ages.gap(profile.age(), record.age()));
  }
}
