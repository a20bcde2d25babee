package ca.gc.cra.match.api;

import ca.gc.cra.match.application.pipeline.MatchingStageException;
import ca.gc.cra.match.application.pipeline.MatchingUseCase;
import ca.gc.cra.match.application.pipeline.RunStage;
import ca.gc.cra.match.config.CompositionRoot;
import ca.gc.cra.match.config.ConfigMerger;
import ca.gc.cra.match.config.DefaultsForMode;
import ca.gc.cra.match.config.MatchConfig;
import ca.gc.cra.match.config.YamlConfigLoader;
import ca.gc.cra.match.domain.error.InvalidInputException;
import ca.gc.cra.match.domain.match.MatchArtifact;
import ca.gc.cra.match.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.match.logging.LoggingConfigurator;
import ca.gc.cra.match.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for a matching run: pairs profiles with clinical records and writes the match artifact.
 *
 * @since 0.1.0
 */
public final class MatchCli {
  private static final Logger log = LoggerFactory.getLogger(MatchCli.class);
  private static final String SUMMARY_USAGE =
      "usage: match run profiles=PATH records=PATH out=PATH [solverMode=AUTO|EXACT|HEURISTIC|BASELINE] "
          + "[config=PATH] [--dry-run] [--verbose] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Cohort matching run

      Usage:
        match run profiles=./profiles.json records=./records.json out=./matches.json [options]

      Inputs and output:
        profiles=PATH              JSON array of demographic profiles
        records=PATH               JSON array of clinical records
        out=PATH                   Artifact file; replaced atomically
        config=PATH                YAML file with 'common' and 'match' sections

      Solver:
        solverMode=MODE            AUTO (default), EXACT, HEURISTIC or BASELINE
        exactThreshold=N           AUTO uses EXACT up to N profiles or records (default 2000)
        maxDenseCells=N            Dense matrix cell budget (default 25000000)
        candidatesPerRow=K         HEURISTIC candidates kept per profile (default 64)
        candidateFloor=S           Minimum candidate score in [0,1] (default 0.0)
        repairPasses=N             HEURISTIC swap passes (default 2)
        repairWindow=N             HEURISTIC swap neighbourhood (default 64)

      Scoring:
        weights.age=W              Age weight (default 0.6)
        weights.socio=W            Socioeconomic weight (default 0.4); weights must sum to 1
        workers=N                  Scoring threads (default: available processors)
        scoringTimeoutSeconds=N    Scoring time budget, 0 = unlimited (default 0)

      Observability:
        metricsExporter=otlp|none  Metrics export (default none)
        otelEndpoint=URL           OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes

      Flags:
        --dry-run                  Validate inputs and print the plan without running
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Precedence: CLI key=value > YAML > defaults.
      """;

  private MatchCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes a matching run.
   *
   * @param args raw CLI arguments following the {@code run} command
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for match run");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(input.options());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = blankToNull(kv.remove("config"));
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, DefaultsForMode.MATCH);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    MatchConfig config;
    TelemetrySettings telemetry;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          DefaultsForMode.MATCH, yamlConfig, kv, DefaultsForMode.asFlatMap(DefaultsForMode.MATCH), log::warn));
      telemetry = TelemetryConfigurator.extract(effective);
      config = MatchConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid match arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.hasFlag("--dry-run") || parseBoolean(effective.get("dryRun"));
    if (!input.verbose() && parseBoolean(effective.get("verbose"))) {
      LoggingConfigurator.enableVerboseLogging();
    }

    if (dryRun) {
      try {
        Paths.validateReadableFile("profiles", config.profilesFile());
        Paths.validateReadableFile("records", config.recordsFile());
        Paths.validateWritableFile("out", config.outputFile(), false);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid match path configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      printDryRunPlan(config, telemetry);
      return ExitCode.SUCCESS;
    }

    try {
      Paths.validateWritableFile("out", config.outputFile(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid match output: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config, telemetry)) {
      return execute(root);
    }
  }

  /**
   * Runs the use case wired by {@code root} and maps the outcome to an exit code.
   *
   * @param root composition root for this run
   * @return exit code
   */
  static ExitCode execute(CompositionRoot root) {
    MatchConfig config = root.config();
    MatchingUseCase useCase = root.matchingUseCase();
    log.info("Configured match run: profiles={}, records={}, out={}, solverMode={}, workers={}",
        config.profilesFile(), config.recordsFile(), config.outputFile(), config.solverMode(), config.workers());
    try {
      MatchArtifact artifact = useCase.run();
      printSummary(artifact, config);
      return ExitCode.SUCCESS;
    } catch (MatchingStageException ex) {
      return exitFor(ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Match run interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in match run", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static ExitCode exitFor(MatchingStageException ex) {
    Throwable cause = ex.getCause();
    if (ex.stage() == RunStage.INIT && cause instanceof InvalidInputException) {
      return ExitCode.CONFIG_ERROR;
    }
    if (cause instanceof IOException) {
      return ExitCode.IO_ERROR;
    }
    return ExitCode.RUNTIME_FAILURE;
  }

  private static void printDryRunPlan(MatchConfig config, TelemetrySettings telemetry) {
    CliPrinter.printLines(
        "Match dry-run: no artifact will be written.",
        " Profiles          : " + config.profilesFile(),
        " Records           : " + config.recordsFile(),
        " Output            : " + config.outputFile(),
        " Solver mode       : " + config.solverMode(),
        " Exact threshold   : " + config.exactThreshold(),
        " Max dense cells   : " + config.maxDenseCells(),
        " Candidates/row    : " + config.candidatesPerRow() + " (floor " + config.candidateFloor() + ")",
        " Repair            : " + config.repairPasses() + " passes, window " + config.repairWindow(),
        " Weights           : age " + config.weights().age() + ", socio " + config.weights().socio(),
        " Workers           : " + config.workers(),
        " Scoring timeout   : " + (config.scoringTimeoutSeconds() == 0
            ? "none" : config.scoringTimeoutSeconds() + "s"),
        " Metrics exporter  : " + (telemetry.exporter().isEmpty() ? "<env>" : telemetry.exporter()),
        " Re-run without --dry-run to match.");
  }

  private static void printSummary(MatchArtifact artifact, MatchConfig config) {
    var diagnostics = artifact.diagnostics();
    CliPrinter.printLines(
        "Match run complete.",
        " Solver mode       : " + artifact.result().solverMode(),
        " Pairs             : " + diagnostics.pairCount(),
        " Unmatched         : " + artifact.result().unmatchedProfiles().size() + " profiles, "
            + artifact.result().unmatchedRecords().size() + " records",
        " Quality index     : " + (diagnostics.noData()
            ? "n/a" : String.format(Locale.ROOT, "%.4f", diagnostics.qualityIndex())),
        " Artifact          : " + config.outputFile());
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
