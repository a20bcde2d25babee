package ca.gc.cra.match.application.port;

import ca.gc.cra.match.domain.match.MatchArtifact;
import java.io.IOException;

/**
 * <strong>What:</strong> Port persisting the single artifact produced by a matching run.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write pairs and diagnostics atomically: consumers see the previous artifact or the new one, never a partial file.</li>
 *   <li>Overwrite a prior run's artifact idempotently.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single writer per run; implementations need not support concurrent saves.</p>
 *
 * @since 0.1.0
 */
public interface MatchRepository {
  /**
   * Persists the artifact, replacing any previous one.
   *
   * @param artifact artifact to write; must not be {@code null}
   * @throws IOException when the artifact cannot be written; the previous artifact stays intact
   */
  void save(MatchArtifact artifact) throws IOException;

  /**
   * Describes where artifacts are written, for logs and dry-run plans.
   *
   * @return human readable location
   */
  String location();
}
