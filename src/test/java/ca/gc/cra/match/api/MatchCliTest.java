package ca.gc.cra.match.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.match.application.pipeline.MatchingStageException;
import ca.gc.cra.match.application.pipeline.RunStage;
import ca.gc.cra.match.domain.error.InvalidInputException;
import ca.gc.cra.match.domain.error.MatrixCapacityException;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class MatchCliTest {
  private static final String PROFILES = """
      [
        {"id": "p1", "age": 28, "demographics": {"education": "bachelors"}},
        {"id": "p2", "age": 32, "demographics": {"education": "masters"}},
        {"id": "p3", "age": 40}
      ]
      """;
  private static final String RECORDS = """
      [
        {"id": "r1", "age": 30, "clinical_profile": {"education": "bachelors"}},
        {"id": "r2", "age": 33, "demographics": {"education": "masters"}},
        {"id": "r3", "age": 41, "conditions": ["I10"]}
      ]
      """;

  @TempDir Path tempDir;

  private StringWriter buffer;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(MatchCli.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    CliPrinter.clearTestWriter();
  }

  @Test
  void runWritesArtifactAndPrintsSummary() throws IOException {
    Path out = tempDir.resolve("out/matches.json");

    ExitCode code = MatchCli.run(new String[] {
        "profiles=" + write("profiles.json", PROFILES),
        "records=" + write("records.json", RECORDS),
        "out=" + out,
        "workers=2"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.exists(out));
    String artifact = Files.readString(out);
    assertTrue(artifact.contains("\"solver_mode\" : \"EXACT\""), artifact);
    assertTrue(buffer.toString().contains("Match run complete."));
    assertTrue(buffer.toString().contains("Pairs             : 3"));
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutput() throws IOException {
    Path out = tempDir.resolve("planned/matches.json");

    ExitCode code = MatchCli.run(new String[] {
        "profiles=" + write("profiles.json", PROFILES),
        "records=" + write("records.json", RECORDS),
        "out=" + out,
        "solverMode=heuristic",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Match dry-run"));
    assertTrue(buffer.toString().contains("HEURISTIC"));
    assertFalse(Files.exists(out.getParent()), "dry-run should not create the output directory");
  }

  @Test
  void yamlConfigSuppliesDefaultsAndCliWins() throws IOException {
    String yaml = write("match.yaml", """
        match:
          solverMode: EXACT
          repairPasses: 5
        """);

    ExitCode code = MatchCli.run(new String[] {
        "config=" + yaml,
        "profiles=" + write("profiles.json", PROFILES),
        "records=" + write("records.json", RECORDS),
        "out=" + tempDir.resolve("matches.json"),
        "solverMode=BASELINE",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Solver mode       : BASELINE"));
    assertTrue(buffer.toString().contains("5 passes"));
  }

  @Test
  void malformedArgumentReturnsUsage() {
    ExitCode code = MatchCli.run(new String[] {"profiles"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: match run"));
  }

  @Test
  void unknownKeyReturnsInvalidArgs() {
    ExitCode code = MatchCli.run(new String[] {"iface=eth0", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Unknown argument: iface"));
    assertTrue(logged);
  }

  @Test
  void dryRunWithMissingInputReturnsInvalidArgs() {
    ExitCode code = MatchCli.run(new String[] {
        "profiles=" + tempDir.resolve("missing.json"),
        "records=" + tempDir.resolve("missing-too.json"),
        "out=" + tempDir.resolve("matches.json"),
        "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void unusableInputFailsRunWithConfigError() throws IOException {
    Path out = tempDir.resolve("matches.json");

    ExitCode code = MatchCli.run(new String[] {
        "profiles=" + write("profiles.json", "{\"not\": \"an array\"}"),
        "records=" + write("records.json", RECORDS),
        "out=" + out});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertFalse(Files.exists(out));
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = MatchCli.run(new String[] {"--help", "bogus"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Cohort matching run"));
  }

  @Test
  void stageFailuresMapToExitCodes() {
    assertEquals(ExitCode.CONFIG_ERROR, MatchCli.exitFor(
        new MatchingStageException(RunStage.INIT, "bad", new InvalidInputException("bad"))));
    assertEquals(ExitCode.IO_ERROR, MatchCli.exitFor(
        new MatchingStageException(RunStage.PERSISTING, "disk", new IOException("disk"))));
    assertEquals(ExitCode.RUNTIME_FAILURE, MatchCli.exitFor(
        new MatchingStageException(RunStage.SCORING, "big", new MatrixCapacityException("big"))));
  }

  private String write(String name, String content) throws IOException {
    return Files.writeString(tempDir.resolve(name), content).toString();
  }
}
