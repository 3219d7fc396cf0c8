package ca.gc.cra.edgeingest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

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

class IngestCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(IngestCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsOptions() {
    ExitCode code = IngestCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("tailSliceMillis=N"));
  }

  @Test
  void dryRunPrintsPlanAndCreatesNothing() {
    Path output = tempDir.resolve("parsed");

    ExitCode code = IngestCli.run(new String[] {
        "activePath=" + tempDir.resolve("fortigate.log"),
        "outputDir=" + output,
        "tailSliceMillis=500",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String text = buffer.toString();
    assertTrue(text.contains("Ingest dry-run: nothing will be read or written."));
    assertTrue(text.contains("Tail slice (ms)    : 500"));
    assertTrue(text.contains(output.resolve("checkpoint.json").toString()));
    assertFalse(Files.exists(output), "dry-run must not create the output directory");
  }

  @Test
  void yamlConfigIsAppliedAndCliOverridesIt() throws IOException {
    Path yaml = tempDir.resolve("edge-ingest.yaml");
    Files.writeString(yaml, """
        ingest:
          activePath: %s
          outputDir: %s
          pollIntervalMillis: 100
        """.formatted(tempDir.resolve("fw.log"), tempDir.resolve("out")));

    ExitCode code = IngestCli.run(new String[] {"config=" + yaml, "pollIntervalMillis=75", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Poll (ms)          : 75"));
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = IngestCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void invalidValueReturnsUsageAndLogsReason() {
    ExitCode code = IngestCli.run(new String[] {"readChunkBytes=12", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: run"));
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("readChunkBytes must be between"));
    assertTrue(logged);
  }

  @Test
  void strayWordIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"now"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: run"));
  }
}
