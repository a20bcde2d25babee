package ca.gc.cra.match.domain.model;

/**
 * Socio-economic sub-dimensions compared by the compatibility scorer, keyed by their wire names.
 *
 * @since 0.1.0
 */
public enum DemographicDimension {
  EDUCATION("education"),
  OCCUPATION_CATEGORY("occupation_category"),
  INCOME_BRACKET("income_bracket"),
  MARITAL_STATUS("marital_status");

  private final String wireName;

  DemographicDimension(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the JSON field name used for this dimension.
   *
   * @return snake_case field name
   */
  public String wireName() {
    return wireName;
  }
}
