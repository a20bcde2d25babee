package ca.gc.cra.match.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the matching pipeline.
 * <p><strong>Why:</strong> The run timestamp is the only non-deterministic field of the artifact; tests inject a fixed clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.match.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
