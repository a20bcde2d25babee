package ca.gc.cra.match.domain.scoring;

import ca.gc.cra.match.domain.model.DemographicDimension;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed similarity lookup for one categorical dimension.
 * <p>Exact match scores {@link #EXACT}, adjacent categories score {@link #ADJACENT}, anything else
 * scores {@link #DISTANT}. Ordinal scales treat neighbouring ranks as adjacent; grouped scales treat
 * members of the same group as adjacent. Values unknown to the scale compare by equality only.</p>
 *
 * @since 0.1.0
 */
public final class CategoryScale {
  public static final double EXACT = 1.0;
  public static final double ADJACENT = 0.5;
  public static final double DISTANT = 0.0;

  private static final Map<DemographicDimension, CategoryScale> STANDARD = buildStandardScales();

  private final Map<String, Integer> ranks;
  private final Map<String, Integer> groups;

  private CategoryScale(Map<String, Integer> ranks, Map<String, Integer> groups) {
    this.ranks = Map.copyOf(ranks);
    this.groups = Map.copyOf(groups);
  }

  /**
   * Builds an ordinal scale where neighbouring ranks are adjacent.
   *
   * @param ordered categories from lowest to highest
   * @return ordinal scale
   */
  public static CategoryScale ordinal(String... ordered) {
    Map<String, Integer> ranks = new HashMap<>();
    for (int i = 0; i < ordered.length; i++) {
      ranks.put(ordered[i], i);
    }
    return new CategoryScale(ranks, Map.of());
  }

  /**
   * Builds a nominal scale where categories sharing a group are adjacent.
   *
   * @param adjacencyGroups groups of mutually adjacent categories
   * @return grouped scale
   */
  public static CategoryScale grouped(List<Set<String>> adjacencyGroups) {
    Map<String, Integer> groups = new HashMap<>();
    for (int i = 0; i < adjacencyGroups.size(); i++) {
      for (String member : adjacencyGroups.get(i)) {
        groups.put(member, i);
      }
    }
    return new CategoryScale(Map.of(), groups);
  }

  /**
   * Returns the built-in scale for a dimension.
   *
   * @param dimension dimension to look up
   * @return scale used by the compatibility scorer
   */
  public static CategoryScale forDimension(DemographicDimension dimension) {
    return STANDARD.get(Objects.requireNonNull(dimension, "dimension"));
  }

  /**
   * Looks up the similarity of two normalized category values.
   *
   * @param left first value; must not be {@code null}
   * @param right second value; must not be {@code null}
   * @return {@link #EXACT}, {@link #ADJACENT} or {@link #DISTANT}
   */
  public double similarity(String left, String right) {
    if (left.equals(right)) {
      return EXACT;
    }
    Integer leftRank = ranks.get(left);
    Integer rightRank = ranks.get(right);
    if (leftRank != null && rightRank != null) {
      return Math.abs(leftRank - rightRank) == 1 ? ADJACENT : DISTANT;
    }
    Integer leftGroup = groups.get(left);
    if (leftGroup != null && leftGroup.equals(groups.get(right))) {
      return ADJACENT;
    }
    return DISTANT;
  }

  private static Map<DemographicDimension, CategoryScale> buildStandardScales() {
    Map<DemographicDimension, CategoryScale> scales = new EnumMap<>(DemographicDimension.class);
    scales.put(DemographicDimension.EDUCATION, ordinal(
        "no_degree", "high_school", "some_college", "bachelors", "masters", "doctorate"));
    scales.put(DemographicDimension.INCOME_BRACKET, ordinal(
        "low", "lower_middle", "middle", "upper_middle", "high"));
    scales.put(DemographicDimension.OCCUPATION_CATEGORY, ordinal(
        "unskilled", "lower_skilled", "medium_skilled", "high_skilled"));
    scales.put(DemographicDimension.MARITAL_STATUS, grouped(List.of(
        Set.of("married", "partnered", "domestic_partnership"),
        Set.of("divorced", "separated"))));
    return scales;
  }
}
