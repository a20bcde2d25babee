package ca.gc.cra.match.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Synthetic demographic profile to be paired with a clinical record.
 * <p><strong>Role:</strong> Domain input; immutable once loaded.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the attribute tree is deep-copied and unmodifiable.</p>
 *
 * @param id unique, non-blank identifier
 * @param age age in years; {@code null} when missing or malformed, may lie outside the plausible range
 * @param demographics categorical demographics; never {@code null}
 * @param attributes free-form attribute tree; never {@code null}
 * @since 0.1.0
 */
public record Profile(String id, Integer age, Demographics demographics, Map<String, Object> attributes) {

  /**
   * Validates the identifier and freezes optional parts.
   *
   * @throws IllegalArgumentException if {@code id} is blank
   */
  public Profile {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("profile id must not be blank");
    }
    demographics = Objects.requireNonNullElse(demographics, Demographics.empty());
    attributes = AttributeTrees.copyOf(attributes);
  }

  /**
   * Convenience constructor for profiles without free-form attributes.
   *
   * @param id unique identifier
   * @param age age in years; may be {@code null}
   * @param demographics categorical demographics
   */
  public Profile(String id, Integer age, Demographics demographics) {
    this(id, age, demographics, Map.of());
  }
}
