package ca.gc.cra.match.domain.match;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything persisted for one run: the pairing, its diagnostics and the run timestamp.
 *
 * @param runTimestamp time the run finished reporting
 * @param result final pairing
 * @param diagnostics quality diagnostics for {@code result}
 * @since 0.1.0
 */
public record MatchArtifact(Instant runTimestamp, MatchResult result, RunDiagnostics diagnostics) {
  public MatchArtifact {
    Objects.requireNonNull(runTimestamp, "runTimestamp");
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(diagnostics, "diagnostics");
  }
}
