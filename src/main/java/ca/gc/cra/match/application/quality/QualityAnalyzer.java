package ca.gc.cra.match.application.quality;

import ca.gc.cra.match.domain.error.MatchingException;
import ca.gc.cra.match.domain.match.MatchedPair;
import ca.gc.cra.match.domain.match.QualityTier;
import ca.gc.cra.match.domain.match.RunDiagnostics;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Summarizes the quality of a finished pairing.
 * <p><strong>Role:</strong> Application service backing the REPORTING stage.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * <p>Age-gap statistics cover only pairs where both ages are known; score statistics cover every pair.
 * Standard deviation is the population form. An empty pairing yields {@link RunDiagnostics#empty()}.</p>
 *
 * @since 0.1.0
 */
public final class QualityAnalyzer {

  /**
   * Computes diagnostics for a pairing.
   *
   * @param pairs matched pairs in any order; must not be {@code null}
   * @return diagnostics
   * @throws MatchingException if tier counts do not add up to the pair count
   */
  public RunDiagnostics analyze(List<MatchedPair> pairs) {
    Objects.requireNonNull(pairs, "pairs");
    if (pairs.isEmpty()) {
      return RunDiagnostics.empty();
    }

    int n = pairs.size();
    double[] scores = new double[n];
    double ageSum = 0.0;
    double socioSum = 0.0;
    Map<QualityTier, Integer> tiers = new EnumMap<>(QualityTier.class);
    int[] gaps = new int[n];
    int known = 0;
    for (int i = 0; i < n; i++) {
      MatchedPair pair = pairs.get(i);
      scores[i] = pair.score();
      ageSum += pair.ageScore();
      socioSum += pair.socioScore();
      tiers.merge(pair.tier(), 1, Integer::sum);
      if (pair.ageGap() != null) {
        gaps[known++] = pair.ageGap();
      }
    }

    int tierTotal = tiers.values().stream().mapToInt(Integer::intValue).sum();
    if (tierTotal != n) {
      throw new MatchingException("tier counts sum to " + tierTotal + " but there are " + n + " pairs");
    }

    Arrays.sort(scores);
    double total = 0.0;
    for (double score : scores) {
      total += score;
    }
    double mean = total / n;
    double variance = 0.0;
    for (double score : scores) {
      variance += (score - mean) * (score - mean);
    }

    Double meanGap = null;
    Double medianGap = null;
    Double within2 = null;
    Double within5 = null;
    if (known > 0) {
      int[] knownGaps = Arrays.copyOf(gaps, known);
      Arrays.sort(knownGaps);
      long gapSum = 0;
      int close = 0;
      int near = 0;
      for (int gap : knownGaps) {
        gapSum += gap;
        if (gap <= 2) {
          close++;
        }
        if (gap <= 5) {
          near++;
        }
      }
      meanGap = (double) gapSum / known;
      medianGap = median(knownGaps);
      within2 = (double) close / known;
      within5 = (double) near / known;
    }

    return new RunDiagnostics(
        n,
        meanGap,
        medianGap,
        within2,
        within5,
        tiers,
        mean,
        total,
        scores[0],
        scores[n - 1],
        median(scores),
        Math.sqrt(variance / n),
        ageSum / n,
        socioSum / n);
  }

  private static double median(double[] sorted) {
    int mid = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
  }

  private static double median(int[] sorted) {
    int mid = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
  }
}
