package ca.gc.cra.match.application.matrix;

import ca.gc.cra.match.application.port.MetricsPort;
import ca.gc.cra.match.domain.error.InvalidInputException;
import ca.gc.cra.match.domain.error.MatchingException;
import ca.gc.cra.match.domain.error.MatrixCapacityException;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import ca.gc.cra.match.domain.scoring.CompatibilityScore;
import ca.gc.cra.match.domain.scoring.CompatibilityScorer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Scores every profile against every record and stores the result as a
 * {@link CompatibilityMatrix}.
 * <p><strong>Why:</strong> Scoring dominates run time for large pools, so rows are fanned out to a worker pool.</p>
 * <p><strong>Role:</strong> Application service backing the SCORING stage.</p>
 * <p><strong>Thread-safety:</strong> One build at a time per instance; scoring tasks own disjoint row ranges
 * and write each cell exactly once.</p>
 * <p><strong>Performance:</strong> O(N x M) scorer calls; memory O(N x M) dense or O(N x K) blocked.</p>
 * <p><strong>Observability:</strong> Logs progress every 1000 profile rows, a neutral-age summary, and
 * emits {@code matching.scoring.cells} and {@code matching.scoring.neutralAge}.</p>
 *
 * <p>Inputs are sorted into canonical order (ascending id) before scoring. The builder never falls
 * back to another layout: a dense request that does not fit raises {@link MatrixCapacityException}.</p>
 *
 * @since 0.1.0
 */
public final class MatrixBuilder {
  private static final Logger log = LoggerFactory.getLogger(MatrixBuilder.class);

  static final int PROGRESS_INTERVAL = 1000;
  private static final int BLOCKS_PER_WORKER = 4;
  // Largest array most JVMs will allocate.
  private static final long MAX_ARRAY_CELLS = Integer.MAX_VALUE - 8L;

  private final CompatibilityScorer scorer;
  private final ExecutorService executor;
  private final MatrixSettings settings;
  private final MetricsPort metrics;

  /**
   * Creates a builder.
   *
   * @param scorer pure pair scorer; must not be {@code null}
   * @param executor pool running row-block tasks; owned by the caller
   * @param settings capacity and sizing knobs; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public MatrixBuilder(
      CompatibilityScorer scorer, ExecutorService executor, MatrixSettings settings, MetricsPort metrics) {
    this.scorer = Objects.requireNonNull(scorer, "scorer");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public CompatibilityScorer scorer() {
    return scorer;
  }

  /**
   * Builds a matrix in the requested layout.
   *
   * @param profiles profiles in any order; ids must be unique
   * @param records records in any order; ids must be unique
   * @param layout storage layout
   * @return populated matrix in canonical order
   * @throws InterruptedException if the calling thread is interrupted while waiting on scoring tasks
   * @throws MatrixCapacityException if a dense matrix exceeds the configured cell budget or memory runs out
   * @throws InvalidInputException if an id repeats within one collection
   * @throws MatchingException if scoring fails or exceeds its time budget
   */
  public CompatibilityMatrix build(List<Profile> profiles, List<ClinicalRecord> records, MatrixLayout layout)
      throws InterruptedException {
    Objects.requireNonNull(layout, "layout");
    List<Profile> rows = canonical(profiles, Profile::id, "profile");
    List<ClinicalRecord> columns = canonical(records, ClinicalRecord::id, "record");
    long cells = (long) rows.size() * columns.size();

    if (layout == MatrixLayout.DENSE) {
      requireDenseCapacity(rows.size(), columns.size(), settings.maxDenseCells());
      double[] values = allocateDense(cells);
      AtomicLong neutral = new AtomicLong();
      runBlocks(rows, columns, (row, column, score) -> values[row * columns.size() + column] = score, neutral);
      finish(cells, neutral.get(), layout);
      return new DenseCompatibilityMatrix(rows, columns, values);
    }

    RowCandidates[] candidates = new RowCandidates[rows.size()];
    int capacity = Math.max(1, Math.min(settings.candidatesPerRow(), columns.size()));
    for (int row = 0; row < candidates.length; row++) {
      candidates[row] = new RowCandidates(capacity, settings.candidateFloor());
    }
    AtomicLong neutral = new AtomicLong();
    runBlocks(rows, columns, (row, column, score) -> candidates[row].offer(column, score), neutral);
    for (int row = 0; row < candidates.length; row++) {
      candidates[row] = candidates[row].trimmed();
    }
    finish(cells, neutral.get(), layout);
    return new BlockedCompatibilityMatrix(rows, columns, candidates, scorer);
  }

  /**
   * Checks that a dense matrix of the given shape fits the cell budget.
   *
   * @param rows profile count
   * @param columns record count
   * @param maxDenseCells configured budget
   * @throws MatrixCapacityException if it does not fit
   */
  public static void requireDenseCapacity(int rows, int columns, long maxDenseCells) {
    long cells = (long) rows * columns;
    if (cells > maxDenseCells || cells > MAX_ARRAY_CELLS) {
      throw new MatrixCapacityException("dense matrix of " + rows + " x " + columns + " = " + cells
          + " cells exceeds maxDenseCells=" + maxDenseCells);
    }
  }

  private static double[] allocateDense(long cells) {
    try {
      return new double[(int) cells];
    } catch (OutOfMemoryError oom) {
      throw new MatrixCapacityException("unable to allocate dense matrix of " + cells + " cells", oom);
    }
  }

  private void runBlocks(
      List<Profile> rows, List<ClinicalRecord> columns, CellSink sink, AtomicLong neutral)
      throws InterruptedException {
    if (rows.isEmpty() || columns.isEmpty()) {
      return;
    }
    int blockCount = Math.max(1, settings.workers() * BLOCKS_PER_WORKER);
    int blockSize = Math.max(1, (rows.size() + blockCount - 1) / blockCount);
    AtomicInteger completedRows = new AtomicInteger();
    List<Callable<Void>> tasks = new ArrayList<>();
    for (int from = 0; from < rows.size(); from += blockSize) {
      int start = from;
      int end = Math.min(rows.size(), from + blockSize);
      tasks.add(() -> {
        scoreRows(rows, columns, start, end, sink, neutral, completedRows);
        return null;
      });
    }

    List<Future<Void>> futures;
    long timeoutNanos = settings.timeout().toNanos();
    if (timeoutNanos > 0) {
      futures = executor.invokeAll(tasks, timeoutNanos, TimeUnit.NANOSECONDS);
    } else {
      futures = executor.invokeAll(tasks);
    }
    for (Future<Void> future : futures) {
      if (future.isCancelled()) {
        throw new MatchingException("scoring exceeded its time budget of "
            + settings.timeout().toSeconds() + "s after " + completedRows.get() + " of " + rows.size()
            + " profile rows");
      }
      try {
        future.get();
      } catch (ExecutionException ex) {
        throw unwrap(ex.getCause());
      }
    }
  }

  private void scoreRows(
      List<Profile> rows,
      List<ClinicalRecord> columns,
      int start,
      int end,
      CellSink sink,
      AtomicLong neutral,
      AtomicInteger completedRows) throws InterruptedException {
    int total = rows.size();
    for (int row = start; row < end; row++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("scoring interrupted at profile row " + row);
      }
      Profile profile = rows.get(row);
      for (int column = 0; column < columns.size(); column++) {
        ClinicalRecord record = columns.get(column);
        CompatibilityScore score = scorer.score(profile, record);
        if (score.neutralAge()) {
          neutral.incrementAndGet();
          if (log.isDebugEnabled()) {
            log.debug("Neutral age score for profile {} and record {}", profile.id(), record.id());
          }
        }
        sink.accept(row, column, score.composite());
      }
      int done = completedRows.incrementAndGet();
      if (done % PROGRESS_INTERVAL == 0) {
        log.info("Scored {}/{} profile rows", done, total);
      }
    }
  }

  private void finish(long cells, long neutral, MatrixLayout layout) {
    metrics.observe("matching.scoring.cells", cells);
    metrics.observe("matching.scoring.neutralAge", neutral);
    if (neutral > 0) {
      log.info("Age fell back to the neutral score for {} of {} pairs", neutral, cells);
    }
    log.info("Built {} compatibility matrix with {} cells", layout, cells);
  }

  private static RuntimeException unwrap(Throwable cause) {
    if (cause instanceof OutOfMemoryError oom) {
      return new MatrixCapacityException("ran out of memory while scoring", oom);
    }
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    if (cause instanceof Error error) {
      throw error;
    }
    return new MatchingException("scoring task failed", cause);
  }

  private static <T> List<T> canonical(List<T> items, Function<T, String> id, String kind) {
    Objects.requireNonNull(items, kind + "s");
    List<T> sorted = new ArrayList<>(items);
    sorted.sort(Comparator.comparing(id));
    for (int i = 1; i < sorted.size(); i++) {
      if (id.apply(sorted.get(i - 1)).equals(id.apply(sorted.get(i)))) {
        throw new InvalidInputException("duplicate " + kind + " id: " + id.apply(sorted.get(i)));
      }
    }
    return List.copyOf(sorted);
  }

  @FunctionalInterface
  private interface CellSink {
    void accept(int row, int column, double score);
  }
}
