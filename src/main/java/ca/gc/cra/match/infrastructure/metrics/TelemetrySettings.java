package ca.gc.cra.match.infrastructure.metrics;

import java.util.Locale;

/**
 * Metrics export settings resolved from configuration.
 * <p>Blank values defer to the standard {@code OTEL_*} environment variables.</p>
 *
 * @param exporter {@code otlp}, {@code none}, or blank
 * @param endpoint OTLP gRPC endpoint, or blank
 * @param resourceAttributes comma-separated {@code key=value} resource attributes, or blank
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {

  public TelemetrySettings {
    exporter = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null ? "" : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings with metrics export switched off.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", "", "");
  }

  public boolean exportDisabled() {
    return "none".equals(exporter);
  }
}
