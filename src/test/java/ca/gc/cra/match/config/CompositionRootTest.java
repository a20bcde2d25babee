package ca.gc.cra.match.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.application.port.RecordingMetricsPort;
import ca.gc.cra.match.domain.match.MatchArtifact;
import ca.gc.cra.match.domain.match.SolverMode;
import ca.gc.cra.match.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.match.infrastructure.metrics.TelemetrySettings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void wiresRunnableUseCase() throws Exception {
    Path profiles = Files.writeString(tempDir.resolve("profiles.json"),
        "[{\"id\": \"p1\", \"age\": 30}, {\"id\": \"p2\", \"age\": 61}]");
    Path records = Files.writeString(tempDir.resolve("records.json"),
        "[{\"id\": \"r1\", \"age\": 60}, {\"id\": \"r2\", \"age\": 31}]");
    Path out = tempDir.resolve("matches.json");
    MatchConfig config = MatchConfig.fromMap(Map.of(
        "profiles", profiles.toString(),
        "records", records.toString(),
        "out", out.toString(),
        "solverMode", "HEURISTIC",
        "workers", "2"));
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    MatchArtifact artifact;
    try (CompositionRoot root = new CompositionRoot(config, metrics)) {
      artifact = root.matchingUseCase().run();
    }

    assertEquals(SolverMode.HEURISTIC, artifact.result().solverMode());
    assertEquals("r2", artifact.result().pairs().get(0).recordId());
    assertEquals("r1", artifact.result().pairs().get(1).recordId());
    assertTrue(Files.exists(out));
    assertEquals(1, metrics.count("matching.run.succeeded"));
  }

  @Test
  void rerunsWriteSameArtifactApartFromTimestamp() throws Exception {
    StringBuilder profiles = new StringBuilder("[");
    StringBuilder records = new StringBuilder("[");
    for (int i = 0; i < 12; i++) {
      profiles.append(i == 0 ? "" : ",").append("{\"id\": \"p").append(i).append("\", \"age\": ")
          .append(25 + (i % 4) * 5).append(", \"demographics\": {\"education\": \"bachelors\"}}");
      records.append(i == 0 ? "" : ",").append("{\"id\": \"r").append(i).append("\", \"age\": ")
          .append(25 + (i % 3) * 5).append("}");
    }
    Path profilesFile = Files.writeString(tempDir.resolve("profiles.json"), profiles.append("]"));
    Path recordsFile = Files.writeString(tempDir.resolve("records.json"), records.append("]"));

    for (String mode : new String[] {"EXACT", "HEURISTIC", "BASELINE"}) {
      String first = runOnce(profilesFile, recordsFile, mode, "first-" + mode + ".json");
      String second = runOnce(profilesFile, recordsFile, mode, "second-" + mode + ".json");

      assertTrue(first.contains("\"solver_mode\" : \"" + mode + "\""), first);
      assertEquals(withoutTimestamp(first), withoutTimestamp(second), mode);
    }
  }

  @Test
  void disabledTelemetryUsesNoOpAdapter() {
    try (CompositionRoot root = new CompositionRoot(MatchConfig.defaults(), TelemetrySettings.disabled())) {
      assertInstanceOf(NoOpMetricsAdapter.class, root.metrics());
      assertEquals(SolverMode.EXACT, root.solverSelector().plan(SolverMode.AUTO, 10, 10).mode());
    }
  }

  private String runOnce(Path profiles, Path records, String mode, String name) throws Exception {
    Path out = tempDir.resolve(name);
    MatchConfig config = MatchConfig.fromMap(Map.of(
        "profiles", profiles.toString(),
        "records", records.toString(),
        "out", out.toString(),
        "solverMode", mode,
        "candidatesPerRow", "3",
        "workers", "3"));
    try (CompositionRoot root = new CompositionRoot(config, new RecordingMetricsPort())) {
      root.matchingUseCase().run();
    }
    return Files.readString(out);
  }

  private static String withoutTimestamp(String artifact) {
    return artifact.replaceAll("\"run_timestamp\" : \"[^\"]*\"", "");
  }
}
