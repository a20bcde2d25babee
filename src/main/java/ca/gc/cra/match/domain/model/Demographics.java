package ca.gc.cra.match.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Categorical demographic attributes shared by profiles and records.
 * <p><strong>Why:</strong> Gives the socio-economic scorer one explicit optional-field schema instead of ad hoc map lookups.</p>
 * <p><strong>Role:</strong> Domain value object.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * <p>Every field is optional. Values are normalized on construction (trimmed, lower-cased, spaces and
 * hyphens folded to underscores); blank values and {@code "unknown"} collapse to {@code null} and are
 * treated as absent by the scorer.</p>
 *
 * @param education education level, e.g. {@code bachelors}; may be {@code null}
 * @param occupationCategory occupation skill category, e.g. {@code medium_skilled}; may be {@code null}
 * @param incomeBracket income bracket, e.g. {@code middle}; may be {@code null}
 * @param maritalStatus marital status, e.g. {@code married}; may be {@code null}
 * @since 0.1.0
 */
public record Demographics(
    String education,
    String occupationCategory,
    String incomeBracket,
    String maritalStatus) {

  private static final Demographics EMPTY = new Demographics(null, null, null, null);

  /**
   * Normalizes the supplied values.
   */
  public Demographics {
    education = normalize(education);
    occupationCategory = normalize(occupationCategory);
    incomeBracket = normalize(incomeBracket);
    maritalStatus = normalize(maritalStatus);
  }

  /**
   * Returns demographics with every dimension absent.
   *
   * @return shared empty instance
   */
  public static Demographics empty() {
    return EMPTY;
  }

  /**
   * Looks up the value recorded for a dimension.
   *
   * @param dimension dimension to read; must not be {@code null}
   * @return normalized value when present
   */
  public Optional<String> valueOf(DemographicDimension dimension) {
    return Optional.ofNullable(switch (dimension) {
      case EDUCATION -> education;
      case OCCUPATION_CATEGORY -> occupationCategory;
      case INCOME_BRACKET -> incomeBracket;
      case MARITAL_STATUS -> maritalStatus;
    });
  }

  /**
   * Indicates whether no dimension carries a value.
   *
   * @return {@code true} when all four dimensions are absent
   */
  public boolean isEmpty() {
    return education == null
        && occupationCategory == null
        && incomeBracket == null
        && maritalStatus == null;
  }

  /**
   * Normalizes a raw categorical value.
   *
   * @param raw raw value from input; may be {@code null}
   * @return normalized token, or {@code null} when blank or unknown
   */
  public static String normalize(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder(trimmed.length());
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      sb.append(c == ' ' || c == '-' ? '_' : c);
    }
    String normalized = sb.toString().toLowerCase(Locale.ROOT);
    return normalized.equals("unknown") ? null : normalized;
  }
}
