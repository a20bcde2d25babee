package ca.gc.cra.match.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Clinical record extracted from the health-record generator.
 * <p><strong>Role:</strong> Domain input; immutable once loaded.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction.</p>
 *
 * @param id unique, non-blank identifier
 * @param age age in years; {@code null} when missing or malformed
 * @param conditions clinical condition codes; never {@code null}
 * @param clinicalProfile optional structured sub-profile; never {@code null}
 * @param demographics demographics declared by the record (directly or inside the clinical profile); never {@code null}
 * @since 0.1.0
 */
public record ClinicalRecord(
    String id,
    Integer age,
    List<String> conditions,
    Map<String, Object> clinicalProfile,
    Demographics demographics) {

  /**
   * Validates the identifier and freezes optional parts.
   *
   * @throws IllegalArgumentException if {@code id} is blank
   */
  public ClinicalRecord {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("record id must not be blank");
    }
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
    clinicalProfile = AttributeTrees.copyOf(clinicalProfile);
    demographics = Objects.requireNonNullElse(demographics, Demographics.empty());
  }

  /**
   * Convenience constructor for records carrying only demographics.
   *
   * @param id unique identifier
   * @param age age in years; may be {@code null}
   * @param demographics categorical demographics
   */
  public ClinicalRecord(String id, Integer age, Demographics demographics) {
    this(id, age, List.of(), Map.of(), demographics);
  }
}
