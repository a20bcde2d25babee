package ca.gc.cra.match.domain.match;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class QualityTierTest {

  @Test
  void boundariesAreInclusive() {
    assertEquals(QualityTier.EXCELLENT, QualityTier.of(0.85));
    assertEquals(QualityTier.GOOD, QualityTier.of(0.8499));
    assertEquals(QualityTier.GOOD, QualityTier.of(0.75));
    assertEquals(QualityTier.FAIR, QualityTier.of(0.65));
    assertEquals(QualityTier.POOR, QualityTier.of(0.6499));
    assertEquals(QualityTier.POOR, QualityTier.of(0.0));
    assertEquals("excellent", QualityTier.EXCELLENT.label());
  }

  @Test
  void solverModeParsesCaseInsensitively() {
    assertEquals(SolverMode.HEURISTIC, SolverMode.parse(" heuristic "));
    assertEquals(SolverMode.AUTO, SolverMode.parse("Auto"));
  }
}
