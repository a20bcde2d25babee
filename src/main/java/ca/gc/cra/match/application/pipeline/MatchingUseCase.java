package ca.gc.cra.match.application.pipeline;

import ca.gc.cra.match.application.matrix.CompatibilityMatrix;
import ca.gc.cra.match.application.matrix.MatrixBuilder;
import ca.gc.cra.match.application.port.ClockPort;
import ca.gc.cra.match.application.port.CollectionLoader;
import ca.gc.cra.match.application.port.MatchRepository;
import ca.gc.cra.match.application.port.MetricsPort;
import ca.gc.cra.match.application.quality.QualityAnalyzer;
import ca.gc.cra.match.application.solver.Assignment;
import ca.gc.cra.match.application.solver.AssignmentSolver;
import ca.gc.cra.match.application.solver.AssignmentValidator;
import ca.gc.cra.match.application.solver.SolverPlan;
import ca.gc.cra.match.application.solver.SolverSelector;
import ca.gc.cra.match.domain.match.MatchArtifact;
import ca.gc.cra.match.domain.match.MatchResult;
import ca.gc.cra.match.domain.match.MatchedPair;
import ca.gc.cra.match.domain.match.QualityTier;
import ca.gc.cra.match.domain.match.RunDiagnostics;
import ca.gc.cra.match.domain.match.SolverMode;
import ca.gc.cra.match.domain.model.ClinicalRecord;
import ca.gc.cra.match.domain.model.Profile;
import ca.gc.cra.match.domain.scoring.CompatibilityScorer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one matching job from input collections to a persisted artifact.
 * <p><strong>Why:</strong> Gives every run an explicit lifecycle so a failure names the stage it happened in
 * and never leaves a partial artifact behind.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the loader, matrix builder, solvers,
 * quality analyzer and repository ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>INIT: load and validate both collections.</li>
 *   <li>SCORING: resolve the solver plan and build the compatibility matrix.</li>
 *   <li>SOLVING: assign, validate, then release the matrix.</li>
 *   <li>REPORTING: compute {@link RunDiagnostics}.</li>
 *   <li>PERSISTING: write the {@link MatchArtifact}; the only stage that touches the output.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; each instance runs at most one job at a time.</p>
 * <p><strong>Observability:</strong> Sets MDC {@code runId} and {@code stage}, emits {@code matching.*} metrics
 * and logs each stage transition.</p>
 *
 * @since 0.1.0
 */
public final class MatchingUseCase {
  private static final Logger log = LoggerFactory.getLogger(MatchingUseCase.class);

  static final String MDC_RUN_ID = "runId";
  static final String MDC_STAGE = "stage";

  private final CollectionLoader loader;
  private final MatrixBuilder matrixBuilder;
  private final SolverSelector selector;
  private final QualityAnalyzer analyzer;
  private final MatchRepository repository;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final SolverMode requestedMode;

  private RunStage stage = RunStage.INIT;
  private RunStage failedStage;

  /**
   * Creates a use case with explicit dependencies.
   *
   * @param loader input collections; must not be {@code null}
   * @param matrixBuilder matrix builder owning the scorer; must not be {@code null}
   * @param selector solver mode resolution; must not be {@code null}
   * @param analyzer diagnostics; must not be {@code null}
   * @param repository artifact sink; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock timestamp source for the artifact; must not be {@code null}
   * @param requestedMode solver mode requested by configuration; must not be {@code null}
   */
  public MatchingUseCase(
      CollectionLoader loader,
      MatrixBuilder matrixBuilder,
      SolverSelector selector,
      QualityAnalyzer analyzer,
      MatchRepository repository,
      MetricsPort metrics,
      ClockPort clock,
      SolverMode requestedMode) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder");
    this.selector = Objects.requireNonNull(selector, "selector");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.requestedMode = Objects.requireNonNull(requestedMode, "requestedMode");
  }

  /**
   * Current lifecycle stage; DONE or FAILED after {@link #run()} returns or throws.
   *
   * @return stage
   */
  public RunStage stage() {
    return stage;
  }

  /**
   * Stage that was executing when the run failed.
   *
   * @return failing stage, or {@code null} when the run has not failed
   */
  public RunStage failedStage() {
    return failedStage;
  }

  /**
   * Executes the run.
   *
   * @return persisted artifact
   * @throws MatchingStageException if any stage fails; the artifact is left untouched unless the
   *     failure happened while persisting, in which case the previous artifact is preserved
   * @throws InterruptedException if interrupted while scoring
   * @throws IllegalStateException if this instance already ran
   */
  public MatchArtifact run() throws InterruptedException {
    if (stage != RunStage.INIT || failedStage != null) {
      throw new IllegalStateException("matching run already executed (stage " + stage + ")");
    }
    String runId = UUID.randomUUID().toString();
    MDC.put(MDC_RUN_ID, runId);
    metrics.increment("matching.run.started");
    try {
      MatchArtifact artifact = execute();
      metrics.increment("matching.run.succeeded");
      return artifact;
    } catch (MatchingStageException ex) {
      metrics.increment("matching.run.failed");
      log.error("Matching run failed in stage {}: {}", ex.stage(), rootMessage(ex));
      throw ex;
    } catch (InterruptedException ex) {
      metrics.increment("matching.run.failed");
      log.error("Matching run interrupted in stage {}", failedStage);
      throw ex;
    } finally {
      MDC.remove(MDC_STAGE);
      MDC.remove(MDC_RUN_ID);
    }
  }

  private MatchArtifact execute() throws InterruptedException {
    enter(RunStage.INIT);
    long started = System.nanoTime();
    List<Profile> profiles;
    List<ClinicalRecord> records;
    try {
      profiles = loader.loadProfiles();
      records = loader.loadRecords();
    } catch (Exception ex) {
      throw fail(ex);
    }
    log.info("Loaded {} profiles and {} records", profiles.size(), records.size());
    if (records.size() > profiles.size()) {
      log.warn("Records outnumber profiles ({} > {}); {} records will stay unmatched",
          records.size(), profiles.size(), records.size() - profiles.size());
    } else if (profiles.size() > records.size()) {
      log.info("{} profiles will stay unmatched", profiles.size() - records.size());
    }
    started = leave(RunStage.INIT, started);

    enter(RunStage.SCORING);
    SolverPlan plan;
    CompatibilityMatrix matrix;
    try {
      plan = selector.plan(requestedMode, profiles.size(), records.size());
      matrix = matrixBuilder.build(profiles, records, plan.layout());
    } catch (InterruptedException ex) {
      markFailed();
      throw ex;
    } catch (Exception ex) {
      throw fail(ex);
    }
    started = leave(RunStage.SCORING, started);

    enter(RunStage.SOLVING);
    MatchResult result;
    try {
      AssignmentSolver solver = selector.solverFor(plan.mode());
      Assignment assignment = solver.solve(matrix);
      AssignmentValidator.validate(matrix, assignment);
      result = toResult(matrix, assignment, matrixBuilder.scorer());
      log.info("{} solver matched {} pairs (total score {})",
          assignment.mode(), result.pairs().size(), String.format(Locale.ROOT, "%.4f", result.totalScore()));
    } catch (Exception ex) {
      throw fail(ex);
    } finally {
      matrix.release();
    }
    metrics.observe("matching.pairs", result.pairs().size());
    metrics.observe("matching.unmatched.profiles", result.unmatchedProfiles().size());
    metrics.observe("matching.unmatched.records", result.unmatchedRecords().size());
    started = leave(RunStage.SOLVING, started);

    enter(RunStage.REPORTING);
    RunDiagnostics diagnostics;
    try {
      diagnostics = analyzer.analyze(result.pairs());
    } catch (Exception ex) {
      throw fail(ex);
    }
    logDiagnostics(diagnostics);
    started = leave(RunStage.REPORTING, started);

    enter(RunStage.PERSISTING);
    MatchArtifact artifact =
        new MatchArtifact(Instant.ofEpochMilli(clock.nowMillis()), result, diagnostics);
    try {
      repository.save(artifact);
    } catch (Exception ex) {
      throw fail(ex);
    }
    log.info("Wrote match artifact to {}", repository.location());
    leave(RunStage.PERSISTING, started);

    transition(RunStage.DONE);
    return artifact;
  }

  static MatchResult toResult(CompatibilityMatrix matrix, Assignment assignment, CompatibilityScorer scorer) {
    List<Profile> profiles = matrix.profiles();
    List<ClinicalRecord> records = matrix.records();
    List<MatchedPair> pairs = new ArrayList<>(assignment.pairCount());
    List<String> unmatchedProfiles = new ArrayList<>();
    boolean[] usedRecord = new boolean[records.size()];
    for (int row = 0; row < profiles.size(); row++) {
      int column = assignment.columnFor(row);
      if (column == Assignment.UNASSIGNED) {
        unmatchedProfiles.add(profiles.get(row).id());
        continue;
      }
      usedRecord[column] = true;
      Profile profile = profiles.get(row);
      ClinicalRecord record = records.get(column);
      pairs.add(MatchedPair.of(profile, record, scorer.score(profile, record)));
    }
    List<String> unmatchedRecords = new ArrayList<>();
    for (int column = 0; column < records.size(); column++) {
      if (!usedRecord[column]) {
        unmatchedRecords.add(records.get(column).id());
      }
    }
    pairs.sort(Comparator.comparing(MatchedPair::profileId).thenComparing(MatchedPair::recordId));
    return new MatchResult(pairs, unmatchedProfiles, unmatchedRecords, assignment.mode());
  }

  private void logDiagnostics(RunDiagnostics diagnostics) {
    if (diagnostics.noData()) {
      log.info("No pairs produced; diagnostics report no data");
      return;
    }
    log.info(
        "Quality index {}; tiers excellent={} good={} fair={} poor={}; mean age gap {}",
        String.format(Locale.ROOT, "%.4f", diagnostics.qualityIndex()),
        diagnostics.count(QualityTier.EXCELLENT),
        diagnostics.count(QualityTier.GOOD),
        diagnostics.count(QualityTier.FAIR),
        diagnostics.count(QualityTier.POOR),
        diagnostics.meanGap() == null ? "n/a" : String.format(Locale.ROOT, "%.2f", diagnostics.meanGap()));
  }

  private void enter(RunStage next) {
    if (next != RunStage.INIT) {
      transition(next);
    }
    MDC.put(MDC_STAGE, next.name());
    log.debug("Entering stage {}", next);
  }

  private long leave(RunStage current, long startedNanos) {
    long now = System.nanoTime();
    metrics.observe("matching.stage." + current.metricName() + ".nanos", now - startedNanos);
    return now;
  }

  private void transition(RunStage next) {
    if (!stage.canAdvanceTo(next)) {
      throw new IllegalStateException("illegal run transition " + stage + " -> " + next);
    }
    stage = next;
  }

  private void markFailed() {
    failedStage = stage;
    stage = RunStage.FAILED;
  }

  private MatchingStageException fail(Exception cause) {
    RunStage current = stage;
    markFailed();
    String condition = cause.getClass().getSimpleName()
        + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    return new MatchingStageException(current, condition, cause);
  }

  private static String rootMessage(MatchingStageException ex) {
    return ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage();
  }
}
