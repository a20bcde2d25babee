package ca.gc.cra.match.application.matrix;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.application.port.RecordingMetricsPort;
import ca.gc.cra.match.domain.error.InvalidInputException;
import ca.gc.cra.match.domain.error.MatrixCapacityException;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Demographics;
import ca.gc.cra.match.domain.model.Profile;
import ca.gc.cra.match.domain.scoring.CompatibilityScorer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MatrixBuilderTest {
  private static final Demographics GRAD = new Demographics("bachelors", null, "middle", null);

  private ExecutorService executor;
  private RecordingMetricsPort metrics;
  private final CompatibilityScorer scorer = new CompatibilityScorer();

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    metrics = new RecordingMetricsPort();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void denseMatrixUsesCanonicalOrderAndScorerValues() throws Exception {
    List<Profile> profiles = List.of(new Profile("p-b", 40, GRAD), new Profile("p-a", 30, GRAD));
    List<ClinicalRecord> records = List.of(
        new ClinicalRecord("r-2", 41, GRAD), new ClinicalRecord("r-1", 30, null));

    CompatibilityMatrix matrix = builder(MatrixSettings.defaults()).build(profiles, records, MatrixLayout.DENSE);

    assertEquals(MatrixLayout.DENSE, matrix.layout());
    assertEquals("p-a", matrix.profiles().get(0).id());
    assertEquals("r-1", matrix.records().get(0).id());
    for (int row = 0; row < 2; row++) {
      for (int column = 0; column < 2; column++) {
        assertEquals(
            scorer.composite(matrix.profiles().get(row), matrix.records().get(column)),
            matrix.score(row, column));
      }
    }
    assertEquals(List.of(4L), metrics.observed("matching.scoring.cells"));
    assertEquals(List.of(0L), metrics.observed("matching.scoring.neutralAge"));
  }

  @Test
  void blockedMatrixRetainsBestCandidatesPerRow() throws Exception {
    List<Profile> profiles = List.of(new Profile("p1", 30, GRAD));
    List<ClinicalRecord> records = new ArrayList<>();
    int[] ages = {30, 31, 45, 70, 33};
    for (int i = 0; i < ages.length; i++) {
      records.add(new ClinicalRecord("r" + i, ages[i], GRAD));
    }
    MatrixSettings settings = new MatrixSettings(100, 2, 0.0, 2, Duration.ZERO);

    CompatibilityMatrix matrix = builder(settings).build(profiles, records, MatrixLayout.BLOCKED);

    List<Integer> visited = new ArrayList<>();
    matrix.forEachCandidate(0, (column, score) -> visited.add(column));
    assertEquals(List.of(0, 1), visited);
    assertEquals(2L, ((BlockedCompatibilityMatrix) matrix).retainedCells());
    // cells outside the candidate list are rescored on demand
    assertEquals(scorer.composite(profiles.get(0), records.get(3)), matrix.score(0, 3));
  }

  @Test
  void candidateFloorDropsWeakCells() throws Exception {
    List<Profile> profiles = List.of(new Profile("p1", 30, GRAD));
    List<ClinicalRecord> records = List.of(
        new ClinicalRecord("r0", 30, GRAD), new ClinicalRecord("r1", 90, null));
    MatrixSettings settings = new MatrixSettings(100, 8, 0.9, 1, Duration.ZERO);

    CompatibilityMatrix matrix = builder(settings).build(profiles, records, MatrixLayout.BLOCKED);

    List<Integer> visited = new ArrayList<>();
    matrix.forEachCandidate(0, (column, score) -> visited.add(column));
    assertEquals(List.of(0), visited);
  }

  @Test
  void denseMatrixOverBudgetIsRejected() {
    List<Profile> profiles = List.of(new Profile("p1", 30, GRAD), new Profile("p2", 31, GRAD));
    List<ClinicalRecord> records = List.of(
        new ClinicalRecord("r1", 30, GRAD), new ClinicalRecord("r2", 31, GRAD));
    MatrixSettings settings = new MatrixSettings(3, 8, 0.0, 1, Duration.ZERO);

    assertThrows(MatrixCapacityException.class,
        () -> builder(settings).build(profiles, records, MatrixLayout.DENSE));
  }

  @Test
  void duplicateIdsAreRejected() {
    List<Profile> profiles = List.of(new Profile("p1", 30, GRAD), new Profile("p1", 31, GRAD));
    List<ClinicalRecord> records = List.of(new ClinicalRecord("r1", 30, GRAD));

    InvalidInputException ex = assertThrows(InvalidInputException.class,
        () -> builder(MatrixSettings.defaults()).build(profiles, records, MatrixLayout.DENSE));
    assertTrue(ex.getMessage().contains("p1"));
  }

  @Test
  void neutralAgePairsAreCounted() throws Exception {
    List<Profile> profiles = List.of(new Profile("p1", null, GRAD), new Profile("p2", 30, GRAD));
    List<ClinicalRecord> records = List.of(new ClinicalRecord("r1", 30, GRAD));

    builder(MatrixSettings.defaults()).build(profiles, records, MatrixLayout.DENSE);

    assertEquals(List.of(1L), metrics.observed("matching.scoring.neutralAge"));
  }

  @Test
  void emptySideProducesEmptyMatrix() throws Exception {
    CompatibilityMatrix matrix = builder(MatrixSettings.defaults())
        .build(List.of(new Profile("p1", 30, GRAD)), List.of(), MatrixLayout.DENSE);

    assertEquals(1, matrix.rows());
    assertEquals(0, matrix.columns());
    List<Integer> visited = new ArrayList<>();
    matrix.forEachCandidate(0, (column, score) -> visited.add(column));
    assertTrue(visited.isEmpty());
  }

  @Test
  void releasedMatrixRejectsReads() throws Exception {
    CompatibilityMatrix matrix = builder(MatrixSettings.defaults()).build(
        List.of(new Profile("p1", 30, GRAD)), List.of(new ClinicalRecord("r1", 30, GRAD)),
        MatrixLayout.BLOCKED);

    matrix.release();

    assertTrue(matrix.isReleased());
    assertThrows(IllegalStateException.class, () -> matrix.score(0, 0));
  }

  private MatrixBuilder builder(MatrixSettings settings) {
    return new MatrixBuilder(scorer, executor, settings, metrics);
  }
}
