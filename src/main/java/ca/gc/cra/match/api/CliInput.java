package ca.gc.cra.match.api;

import ca.gc.cra.match.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits raw CLI arguments into flags ({@code --dry-run}, {@code --verbose}, {@code --help}) and
 * {@code key=value} options.
 * <p>Parsing never throws; malformed options are remembered and reported by {@link #options()} so that
 * {@code --help} still works next to a bad argument.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private final List<String> optionArgs;
  private final Set<String> flags;

  private CliInput(List<String> optionArgs, Set<String> flags) {
    this.optionArgs = optionArgs;
    this.flags = flags;
  }

  /**
   * Classifies arguments.
   *
   * @param args raw arguments; {@code null} entries are skipped
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> options = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_FLAGS.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          flags.add(lower);
        } else {
          options.add(arg);
        }
      }
    }
    return new CliInput(List.copyOf(options), Set.copyOf(flags));
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  public Set<String> flags() {
    return flags;
  }

  /**
   * Returns the {@code key=value} options in argument order; later duplicates win.
   *
   * @return mutable copy of the options
   * @throws IllegalArgumentException if an option is not {@code key=value} or has an invalid key or value
   */
  public Map<String, String> options() {
    Map<String, String> map = new LinkedHashMap<>();
    for (String arg : optionArgs) {
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + arg + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (key.startsWith("--")) {
        key = key.substring(2);
      }
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!value.isEmpty()) {
        value = Strings.requireNonBlank(key, value);
      }
      map.put(key, value);
    }
    return map;
  }
}
