package ca.gc.cra.match.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.domain.match.SolverMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MatchConfigTest {

  @Test
  void fromMapParsesEveryKey() {
    Map<String, String> options = new HashMap<>();
    options.put("profiles", "/data/profiles.json");
    options.put("records", "/data/records.json");
    options.put("out", "/data/out/../matches.json");
    options.put("solverMode", "baseline");
    options.put("exactThreshold", "50");
    options.put("maxDenseCells", "1000");
    options.put("candidatesPerRow", "8");
    options.put("candidateFloor", "0.25");
    options.put("repairPasses", "0");
    options.put("repairWindow", "16");
    options.put("weights.age", "0.5");
    options.put("weights.socio", "0.5");
    options.put("workers", "3");
    options.put("scoringTimeoutSeconds", "30");

    MatchConfig config = MatchConfig.fromMap(options);

    assertEquals(Path.of("/data/matches.json"), config.outputFile());
    assertEquals(SolverMode.BASELINE, config.solverMode());
    assertEquals(50, config.exactThreshold());
    assertEquals(0.5, config.weights().age());
    assertEquals(Duration.ofSeconds(30), config.matrixSettings().timeout());
    assertEquals(8, config.matrixSettings().candidatesPerRow());
    assertEquals(3, config.matrixSettings().workers());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    MatchConfig config = MatchConfig.fromMap(Map.of("solverMode", "", "exactThreshold", " "));
    MatchConfig defaults = MatchConfig.defaults();

    assertEquals(SolverMode.AUTO, config.solverMode());
    assertEquals(2000, config.exactThreshold());
    assertEquals(defaults.profilesFile(), config.profilesFile());
    assertTrue(config.outputFile().endsWith(Path.of(".match", "out", "matches.json")));
  }

  @Test
  void malformedOrOutOfRangeValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("workers", "lots")));
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("workers", "0")));
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("candidateFloor", "1.5")));
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("solverMode", "FAST")));
    assertThrows(IllegalArgumentException.class, () -> MatchConfig.fromMap(Map.of("weights.age", "0.9")));
    assertThrows(IllegalArgumentException.class,
        () -> MatchConfig.fromMap(Map.of("exactThreshold", "99999999999")));
  }

  @Test
  void homeDirectoryIsExpanded() {
    MatchConfig config = MatchConfig.fromMap(Map.of("profiles", "~/cohort/profiles.json"));

    assertEquals(Path.of(System.getProperty("user.home"), "cohort", "profiles.json").toAbsolutePath().normalize(),
        config.profilesFile());
  }
}
