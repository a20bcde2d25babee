package ca.gc.cra.match.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flat default configuration maps per CLI mode.
 * <p>The lowest layer of the merge performed by {@link ConfigMerger}; YAML and CLI values override it.
 * The key set doubles as the list of recognized configuration keys.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  /** Mode name of the matching run command and YAML section. */
  public static final String MATCH = "match";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for a mode.
   *
   * @param mode mode name, case-insensitive
   * @return immutable flat map
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!MATCH.equals(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(buildMatchDefaults());
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildMatchDefaults() {
    MatchConfig defaults = MatchConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("profiles", defaults.profilesFile().toString());
    map.put("records", defaults.recordsFile().toString());
    map.put("out", defaults.outputFile().toString());
    map.put("solverMode", defaults.solverMode().name());
    map.put("exactThreshold", Integer.toString(defaults.exactThreshold()));
    map.put("maxDenseCells", Long.toString(defaults.maxDenseCells()));
    map.put("candidatesPerRow", Integer.toString(defaults.candidatesPerRow()));
    map.put("candidateFloor", Double.toString(defaults.candidateFloor()));
    map.put("repairPasses", Integer.toString(defaults.repairPasses()));
    map.put("repairWindow", Integer.toString(defaults.repairWindow()));
    map.put("weights.age", Double.toString(defaults.weights().age()));
    map.put("weights.socio", Double.toString(defaults.weights().socio()));
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("scoringTimeoutSeconds", Long.toString(defaults.scoringTimeoutSeconds()));
    map.put("dryRun", "false");
    return map;
  }
}
