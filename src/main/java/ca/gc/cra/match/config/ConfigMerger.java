package ca.gc.cra.match.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI values into one effective map; precedence is CLI over YAML over defaults.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param mode mode whose rules apply
   * @param yaml flattened YAML values, if a file was supplied
   * @param cli parsed {@code key=value} arguments
   * @param defaults defaults for the mode; also the set of recognized keys
   * @param warn receives override and unknown-key notices; may be {@code null}
   * @return immutable effective map
   * @throws IllegalArgumentException when the merged values are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> notices = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(entry.getKey())) {
        notices.accept("Ignoring unknown YAML key: " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (!defaultsCopy.isEmpty() && !defaultsCopy.containsKey(key)) {
        throw new IllegalArgumentException("Unknown argument: " + key);
      }
      if (yamlCopy.containsKey(key)) {
        notices.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String profiles = trim(effective.get("profiles"));
    String records = trim(effective.get("records"));
    String out = trim(effective.get("out"));
    if (!out.isEmpty() && (out.equals(profiles) || out.equals(records))) {
      throw new IllegalArgumentException("out must not overwrite an input file: " + out);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
