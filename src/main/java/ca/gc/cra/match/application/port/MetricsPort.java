package ca.gc.cra.match.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for matching runs.
 * <p><strong>Why:</strong> Lets the pipeline record stage latencies and pair counts without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from scoring workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code matching.stage.solving.nanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code matching.run.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);
}
