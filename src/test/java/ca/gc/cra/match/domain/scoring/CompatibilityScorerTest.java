package ca.gc.cra.match.domain.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Demographics;
import ca.gc.cra.match.domain.model.Profile;
import org.junit.jupiter.api.Test;

class CompatibilityScorerTest {
  private static final Demographics FULL =
      new Demographics("Bachelors", "medium-skilled", "middle", "Married");

  private final CompatibilityScorer scorer = new CompatibilityScorer();

  @Test
  void identicalPairScoresExactlyOne() {
    CompatibilityScore score = scorer.score(
        new Profile("p1", 30, FULL), new ClinicalRecord("r1", 30, FULL));

    assertEquals(1.0, score.composite());
    assertEquals(1.0, score.age());
    assertEquals(1.0, score.socio());
    assertEquals(4, score.dimensionsCompared());
    assertFalse(score.neutralAge());
  }

  @Test
  void compositeIsWeightedBlend() {
    CompatibilityScore score = scorer.score(
        new Profile("p1", 30, FULL), new ClinicalRecord("r1", 33, FULL));

    assertEquals(0.7, score.age(), 1e-12);
    assertEquals(0.6 * 0.7 + 0.4 * 1.0, score.composite(), 1e-12);
  }

  @Test
  void missingDimensionsAreExcludedFromSocioAverage() {
    Demographics partial = new Demographics("masters", null, "unknown", " ");
    CompatibilityScore score = scorer.score(
        new Profile("p1", 50, FULL), new ClinicalRecord("r1", 50, partial));

    assertEquals(1, score.dimensionsCompared());
    assertEquals(CategoryScale.ADJACENT, score.socio(), 1e-12);
  }

  @Test
  void noComparableDimensionFallsBackToNeutralSocio() {
    CompatibilityScore score = scorer.score(
        new Profile("p1", 50, Demographics.empty()), new ClinicalRecord("r1", 50, FULL));

    assertEquals(0, score.dimensionsCompared());
    assertEquals(CompatibilityScorer.NEUTRAL_SOCIO, score.socio());
  }

  @Test
  void implausibleAgeIsFlaggedNeutral() {
    CompatibilityScore score = scorer.score(
        new Profile("p1", 150, FULL), new ClinicalRecord("r1", 40, FULL));

    assertTrue(score.neutralAge());
    assertEquals(AgeScorePolicy.NEUTRAL, score.age());
  }

  @Test
  void customWeightsApply() {
    CompatibilityScorer ageOnly = new CompatibilityScorer(new ScoringWeights(1.0, 0.0));

    double composite = ageOnly.composite(
        new Profile("p1", 30, FULL), new ClinicalRecord("r1", 30, Demographics.empty()));

    assertEquals(1.0, composite, 1e-12);
  }

  @Test
  void weightsMustSumToOne() {
    assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.5, 0.6));
    assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(-0.1, 1.1));
    assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(Double.NaN, 0.4));
  }
}
