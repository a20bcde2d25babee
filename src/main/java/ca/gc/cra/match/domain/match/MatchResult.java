package ca.gc.cra.match.domain.match;

import java.util.List;
import java.util.Objects;

/**
 * Final pairing of one run, including the entries the smaller pool left unmatched.
 *
 * @param pairs matched pairs ordered by profile id then record id
 * @param unmatchedProfiles ids of profiles left without a record, ascending
 * @param unmatchedRecords ids of records left without a profile, ascending
 * @param solverMode strategy that produced the pairing (never {@link SolverMode#AUTO})
 * @since 0.1.0
 */
public record MatchResult(
    List<MatchedPair> pairs,
    List<String> unmatchedProfiles,
    List<String> unmatchedRecords,
    SolverMode solverMode) {

  public MatchResult {
    pairs = List.copyOf(pairs);
    unmatchedProfiles = List.copyOf(unmatchedProfiles);
    unmatchedRecords = List.copyOf(unmatchedRecords);
    Objects.requireNonNull(solverMode, "solverMode");
    if (solverMode == SolverMode.AUTO) {
      throw new IllegalArgumentException("solverMode must be resolved before building a result");
    }
  }

  /**
   * Sums the composite scores of all pairs.
   *
   * @return total score
   */
  public double totalScore() {
    double total = 0.0;
    for (MatchedPair pair : pairs) {
      total += pair.score();
    }
    return total;
  }
}
