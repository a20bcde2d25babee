package ca.gc.cra.match.domain.match;

import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate diagnostics over one run's matched pairs.
 * <p>Gap statistics cover only pairs where both ages are known; they are {@code null} when no such
 * pair exists. Score statistics are {@code null} when the pairing is empty ({@link #noData()}).</p>
 *
 * @param pairCount number of matched pairs
 * @param meanGap mean age gap in years
 * @param medianGap median age gap in years
 * @param within2Years proportion of gap-bearing pairs with a gap of at most 2 years
 * @param within5Years proportion of gap-bearing pairs with a gap of at most 5 years
 * @param tierCounts count per quality tier; always contains every tier
 * @param qualityIndex mean composite score
 * @param totalScore sum of composite scores
 * @param scoreMin lowest composite score
 * @param scoreMax highest composite score
 * @param scoreMedian median composite score
 * @param scoreStdDev population standard deviation of composite scores
 * @param meanAgeScore mean age sub-score
 * @param meanSocioScore mean socio-economic sub-score
 * @since 0.1.0
 */
public record RunDiagnostics(
    int pairCount,
    Double meanGap,
    Double medianGap,
    Double within2Years,
    Double within5Years,
    Map<QualityTier, Integer> tierCounts,
    Double qualityIndex,
    double totalScore,
    Double scoreMin,
    Double scoreMax,
    Double scoreMedian,
    Double scoreStdDev,
    Double meanAgeScore,
    Double meanSocioScore) {

  public RunDiagnostics {
    Map<QualityTier, Integer> counts = new EnumMap<>(QualityTier.class);
    for (QualityTier tier : QualityTier.values()) {
      counts.put(tier, tierCounts == null ? 0 : tierCounts.getOrDefault(tier, 0));
    }
    tierCounts = Map.copyOf(counts);
  }

  /**
   * Returns the defined "no data" result for an empty pairing.
   *
   * @return diagnostics with zero counts and no statistics
   */
  public static RunDiagnostics empty() {
    return new RunDiagnostics(
        0, null, null, null, null, Map.of(), null, 0.0, null, null, null, null, null, null);
  }

  /**
   * Indicates whether the pairing was empty.
   *
   * @return {@code true} when no pair was matched
   */
  public boolean noData() {
    return pairCount == 0;
  }

  /**
   * Returns the count recorded for a tier.
   *
   * @param tier tier to query
   * @return count, zero when none
   */
  public int count(QualityTier tier) {
    return tierCounts.getOrDefault(tier, 0);
  }
}
