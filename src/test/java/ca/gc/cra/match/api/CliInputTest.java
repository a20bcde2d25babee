package ca.gc.cra.match.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.infrastructure.metrics.TelemetrySettings;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromOptions() {
    CliInput input = CliInput.parse(new String[] {"--dry-run", "-v", "--out=/tmp/x.json", "workers=4", " "});

    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertEquals(Map.of("out", "/tmp/x.json", "workers", "4"), input.options());
  }

  @Test
  void malformedOptionsSurfaceOnlyWhenRequested() {
    CliInput input = CliInput.parse(new String[] {"--help", "=oops"});

    assertTrue(input.help());
    assertThrows(IllegalArgumentException.class, input::options);
  }

  @Test
  void invalidKeysRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> CliInput.parse(new String[] {"bad key=1"}).options());
  }

  @Test
  void telemetryKeysAreExtractedAndValidated() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP", "otelEndpoint", "http://collector:4317", "workers", "2"));

    TelemetrySettings settings = TelemetryConfigurator.extract(args);

    assertEquals("otlp", settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals(Map.of("workers", "2"), args);
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.extract(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.extract(new HashMap<>(Map.of("otelEndpoint", "ftp://x"))));
  }
}
