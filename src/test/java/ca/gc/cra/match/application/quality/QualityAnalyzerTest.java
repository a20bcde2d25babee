package ca.gc.cra.match.application.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.domain.match.MatchedPair;
import ca.gc.cra.match.domain.match.QualityTier;
import ca.gc.cra.match.domain.match.RunDiagnostics;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityAnalyzerTest {
  private final QualityAnalyzer analyzer = new QualityAnalyzer();

  @Test
  void summarizesGapsScoresAndTiers() {
    List<MatchedPair> pairs = List.of(
        pair("p1", "r1", 0.9, 0),
        pair("p2", "r2", 0.8, 2),
        pair("p3", "r3", 0.7, 4),
        pair("p4", "r4", 0.4, 10));

    RunDiagnostics diagnostics = analyzer.analyze(pairs);

    assertEquals(4, diagnostics.pairCount());
    assertEquals(4.0, diagnostics.meanGap(), 1e-12);
    assertEquals(3.0, diagnostics.medianGap(), 1e-12);
    assertEquals(0.5, diagnostics.within2Years(), 1e-12);
    assertEquals(0.75, diagnostics.within5Years(), 1e-12);
    assertEquals(0.7, diagnostics.qualityIndex(), 1e-12);
    assertEquals(2.8, diagnostics.totalScore(), 1e-12);
    assertEquals(0.4, diagnostics.scoreMin());
    assertEquals(0.9, diagnostics.scoreMax());
    assertEquals(0.75, diagnostics.scoreMedian(), 1e-12);
    assertEquals(Math.sqrt(0.035), diagnostics.scoreStdDev(), 1e-12);
    assertEquals(1, diagnostics.count(QualityTier.EXCELLENT));
    assertEquals(1, diagnostics.count(QualityTier.GOOD));
    assertEquals(1, diagnostics.count(QualityTier.FAIR));
    assertEquals(1, diagnostics.count(QualityTier.POOR));
  }

  @Test
  void unknownGapsAreExcludedFromAgeStatistics() {
    List<MatchedPair> pairs = List.of(pair("p1", "r1", 0.9, 1), pair("p2", "r2", 0.5, null));

    RunDiagnostics diagnostics = analyzer.analyze(pairs);

    assertEquals(2, diagnostics.pairCount());
    assertEquals(1.0, diagnostics.meanGap(), 1e-12);
    assertEquals(1.0, diagnostics.within2Years(), 1e-12);
  }

  @Test
  void allGapsUnknownLeavesAgeStatisticsEmpty() {
    RunDiagnostics diagnostics = analyzer.analyze(List.of(pair("p1", "r1", 0.5, null)));

    assertNull(diagnostics.meanGap());
    assertNull(diagnostics.within5Years());
    assertEquals(0.5, diagnostics.qualityIndex(), 1e-12);
  }

  @Test
  void emptyPairingReportsNoData() {
    RunDiagnostics diagnostics = analyzer.analyze(List.of());

    assertTrue(diagnostics.noData());
    assertNull(diagnostics.qualityIndex());
    assertNull(diagnostics.meanGap());
    assertEquals(0, diagnostics.count(QualityTier.EXCELLENT));
    assertEquals(0.0, diagnostics.totalScore());
  }

  private static MatchedPair pair(String profileId, String recordId, double score, Integer gap) {
    return new MatchedPair(profileId, recordId, score, score, score, QualityTier.of(score), gap);
  }
}
