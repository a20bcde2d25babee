/**
 * Metrics adapters bridging {@link ca.gc.cra.match.application.port.MetricsPort} to OpenTelemetry or a no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; scoring workers may record concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code matching.*} namespace.</p>
 */
package ca.gc.cra.match.infrastructure.metrics;
