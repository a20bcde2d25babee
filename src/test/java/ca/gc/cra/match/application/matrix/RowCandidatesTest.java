package ca.gc.cra.match.application.matrix;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RowCandidatesTest {

  @Test
  void keepsBestScoresWithLowerColumnOnTies() {
    RowCandidates candidates = new RowCandidates(3, 0.0);
    candidates.offer(4, 0.5);
    candidates.offer(1, 0.9);
    candidates.offer(3, 0.7);
    candidates.offer(2, 0.7);
    candidates.offer(0, 0.1);

    assertEquals(3, candidates.size());
    assertEquals(1, candidates.column(0));
    assertEquals(2, candidates.column(1));
    assertEquals(3, candidates.column(2));
    assertTrue(Double.isNaN(candidates.find(4)));
    assertEquals(0.7, candidates.find(3));
  }

  @Test
  void trimmedCopyKeepsOnlyRetainedCells() {
    RowCandidates candidates = new RowCandidates(8, 0.5);
    candidates.offer(0, 0.4);
    candidates.offer(1, 0.6);

    RowCandidates trimmed = candidates.trimmed();

    assertEquals(1, trimmed.size());
    assertEquals(1, trimmed.column(0));
  }
}
