package ca.gc.cra.match.config;

import ca.gc.cra.match.application.matrix.MatrixBuilder;
import ca.gc.cra.match.application.pipeline.MatchingUseCase;
import ca.gc.cra.match.application.port.ClockPort;
import ca.gc.cra.match.application.port.CollectionLoader;
import ca.gc.cra.match.application.port.MatchRepository;
import ca.gc.cra.match.application.port.MetricsPort;
import ca.gc.cra.match.application.quality.QualityAnalyzer;
import ca.gc.cra.match.application.solver.SolverSelector;
import ca.gc.cra.match.domain.scoring.CompatibilityScorer;
import ca.gc.cra.match.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.match.infrastructure.input.JsonCollectionLoader;
import ca.gc.cra.match.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.match.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.match.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.match.infrastructure.persistence.JsonMatchRepository;
import ca.gc.cra.match.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the ports and adapters of a matching run.
 * <p><strong>Role:</strong> Single place where infrastructure implementations are chosen; owns the scoring
 * pool and the metrics exporter and releases both on {@link #close()}.</p>
 * <p><strong>Thread-safety:</strong> Create and use on the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MatchConfig config;
  private final MetricsPort metrics;
  private final AutoCloseable metricsHandle;
  private ExecutorService scoringPool;

  /**
   * Creates a root exporting metrics according to {@code telemetry}.
   *
   * @param config validated run configuration
   * @param telemetry metrics exporter settings
   */
  public CompositionRoot(MatchConfig config, TelemetrySettings telemetry) {
    this.config = Objects.requireNonNull(config, "config");
    Objects.requireNonNull(telemetry, "telemetry");
    if (telemetry.exportDisabled()) {
      NoOpMetricsAdapter noop = new NoOpMetricsAdapter();
      this.metrics = noop;
      this.metricsHandle = noop;
    } else {
      OpenTelemetryMetricsAdapter otel = new OpenTelemetryMetricsAdapter(telemetry);
      this.metrics = otel;
      this.metricsHandle = otel;
    }
  }

  /**
   * Creates a root with an explicit metrics port, typically a test double.
   *
   * @param config validated run configuration
   * @param metrics metrics port; not closed by this root
   */
  public CompositionRoot(MatchConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.metricsHandle = () -> {};
  }

  public MatchConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public CollectionLoader collectionLoader() {
    return new JsonCollectionLoader(config.profilesFile(), config.recordsFile());
  }

  public MatchRepository matchRepository() {
    return new JsonMatchRepository(config.outputFile());
  }

  public ClockPort clock() {
    return new SystemClockAdapter();
  }

  public SolverSelector solverSelector() {
    return new SolverSelector(
        config.exactThreshold(), config.maxDenseCells(), config.repairPasses(), config.repairWindow());
  }

  /**
   * Builds the matrix builder, starting the scoring pool on first use.
   *
   * @return matrix builder sharing this root's pool
   */
  public MatrixBuilder matrixBuilder() {
    if (scoringPool == null) {
      scoringPool = ExecutorFactories.newScoringPool(
          config.workers(),
          "match-score",
          (thread, ex) -> log.error("Uncaught failure on scoring thread {}", thread.getName(), ex));
    }
    return new MatrixBuilder(
        new CompatibilityScorer(config.weights()), scoringPool, config.matrixSettings(), metrics);
  }

  /**
   * Builds a fully wired use case for one run.
   *
   * @return matching use case
   */
  public MatchingUseCase matchingUseCase() {
    return new MatchingUseCase(
        collectionLoader(),
        matrixBuilder(),
        solverSelector(),
        new QualityAnalyzer(),
        matchRepository(),
        metrics,
        clock(),
        config.solverMode());
  }

  /** Stops the scoring pool and flushes metrics. */
  @Override
  public void close() {
    if (scoringPool != null) {
      scoringPool.shutdownNow();
      try {
        if (!scoringPool.awaitTermination(5, TimeUnit.SECONDS)) {
          log.warn("Scoring pool did not terminate within 5s");
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while stopping scoring pool");
      }
    }
    try {
      metricsHandle.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics exporter", ex);
    }
  }
}
