package ca.gc.cra.match.config;

import ca.gc.cra.match.application.matrix.MatrixSettings;
import ca.gc.cra.match.domain.match.SolverMode;
import ca.gc.cra.match.domain.scoring.ScoringWeights;
import ca.gc.cra.match.validation.Numbers;
import ca.gc.cra.match.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration for a matching run.
 *
 * @param profilesFile JSON array of profiles
 * @param recordsFile JSON array of clinical records
 * @param outputFile artifact destination
 * @param solverMode requested solver mode
 * @param exactThreshold largest pool side AUTO still solves exactly
 * @param maxDenseCells dense matrix cell budget
 * @param candidatesPerRow blocked matrix candidates kept per profile
 * @param candidateFloor minimum score of a retained candidate
 * @param repairPasses heuristic repair passes
 * @param repairWindow heuristic repair neighbourhood
 * @param weights composite score weights
 * @param workers scoring worker threads
 * @param scoringTimeoutSeconds scoring wall-clock budget; 0 disables it
 * @since 0.1.0
 */
public record MatchConfig(
    Path profilesFile,
    Path recordsFile,
    Path outputFile,
    SolverMode solverMode,
    int exactThreshold,
    long maxDenseCells,
    int candidatesPerRow,
    double candidateFloor,
    int repairPasses,
    int repairWindow,
    ScoringWeights weights,
    int workers,
    long scoringTimeoutSeconds) {

  static final int MAX_WORKERS = 1024;
  private static final Path DEFAULT_BASE = defaultBaseDirectory();

  public MatchConfig {
    profilesFile = normalizePath("profiles", profilesFile);
    recordsFile = normalizePath("records", recordsFile);
    outputFile = normalizePath("out", outputFile);
    solverMode = Objects.requireNonNullElse(solverMode, SolverMode.AUTO);
    Numbers.requireRange("exactThreshold", exactThreshold, 0, Integer.MAX_VALUE);
    Numbers.requireRange("maxDenseCells", maxDenseCells, 1, Integer.MAX_VALUE - 8L);
    Numbers.requireRange("candidatesPerRow", candidatesPerRow, 1, 100_000);
    Numbers.requireUnitInterval("candidateFloor", candidateFloor);
    Numbers.requireRange("repairPasses", repairPasses, 0, 1_000);
    Numbers.requireRange("repairWindow", repairWindow, 1, 100_000);
    weights = Objects.requireNonNull(weights, "weights");
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("scoringTimeoutSeconds", scoringTimeoutSeconds, 0, Long.MAX_VALUE / 1_000_000_000L);
  }

  /**
   * Returns the shipped defaults.
   *
   * @return default configuration rooted at {@code ~/.match}
   */
  public static MatchConfig defaults() {
    return new MatchConfig(
        DEFAULT_BASE.resolve("in").resolve("profiles.json"),
        DEFAULT_BASE.resolve("in").resolve("records.json"),
        DEFAULT_BASE.resolve("out").resolve("matches.json"),
        SolverMode.AUTO,
        2_000,
        25_000_000L,
        64,
        0.0,
        2,
        64,
        ScoringWeights.defaults(),
        Math.max(1, Math.min(MAX_WORKERS, Runtime.getRuntime().availableProcessors())),
        0L);
  }

  /**
   * Builds a configuration from a flat key/value map, falling back to {@link #defaults()} per key.
   *
   * @param options merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static MatchConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    MatchConfig defaults = defaults();
    return new MatchConfig(
        pathOr(options, "profiles", defaults.profilesFile()),
        pathOr(options, "records", defaults.recordsFile()),
        pathOr(options, "out", defaults.outputFile()),
        SolverMode.parse(options.get("solverMode")),
        intOr(options, "exactThreshold", defaults.exactThreshold()),
        longOr(options, "maxDenseCells", defaults.maxDenseCells()),
        intOr(options, "candidatesPerRow", defaults.candidatesPerRow()),
        doubleOr(options, "candidateFloor", defaults.candidateFloor()),
        intOr(options, "repairPasses", defaults.repairPasses()),
        intOr(options, "repairWindow", defaults.repairWindow()),
        new ScoringWeights(
            doubleOr(options, "weights.age", defaults.weights().age()),
            doubleOr(options, "weights.socio", defaults.weights().socio())),
        intOr(options, "workers", defaults.workers()),
        longOr(options, "scoringTimeoutSeconds", defaults.scoringTimeoutSeconds()));
  }

  /**
   * Matrix construction settings derived from this configuration.
   *
   * @return matrix settings
   */
  public MatrixSettings matrixSettings() {
    return new MatrixSettings(
        maxDenseCells, candidatesPerRow, candidateFloor, workers, Duration.ofSeconds(scoringTimeoutSeconds));
  }

  private static Path pathOr(Map<String, String> options, String key, Path fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = Strings.requireNonBlank(key, raw);
    if (value.equals("~") || value.startsWith("~/")) {
      value = System.getProperty("user.home", ".") + value.substring(1);
    }
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  private static long longOr(Map<String, String> options, String key, long fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static int intOr(Map<String, String> options, String key, int fallback) {
    long value = longOr(options, key, fallback);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(key + " is out of range (was " + value + ")");
    }
    return (int) value;
  }

  private static double doubleOr(Map<String, String> options, String key, double fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }

  private static Path defaultBaseDirectory() {
    String home = System.getProperty("user.home", ".");
    return Path.of(home, ".match");
  }
}
