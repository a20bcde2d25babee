package ca.gc.cra.match.infrastructure.metrics;

import ca.gc.cra.match.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort, AutoCloseable {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}

  @Override
  public void close() {}
}
