package ca.gc.cra.edgeingest.api;

import ca.gc.cra.edgeingest.application.pipeline.IngestUseCase;
import ca.gc.cra.edgeingest.application.port.CheckpointException;
import ca.gc.cra.edgeingest.config.CompositionRoot;
import ca.gc.cra.edgeingest.config.IngestConfig;
import ca.gc.cra.edgeingest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.edgeingest.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.edgeingest.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code run}: follows the FortiGate log until the process is stopped.
 *
 * <p>A JVM shutdown hook interrupts the loop thread and waits for the final checkpoint flush.</p>
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final long SHUTDOWN_GRACE_MILLIS = 10_000L;
  private static final String SUMMARY_USAGE =
      "usage: run [config=PATH] [activePath=PATH] [outputDir=PATH] [key=value ...] [--dry-run]";
  private static final String HELP_TEXT = """
      Edge ingest loop

      Usage:
        run [options]

      Options:
        config=PATH                   YAML file with 'common' and 'ingest' sections
        activePath=PATH               Active FortiGate log (default /data/fortigate/fortigate.log)
        rotatedDir=PATH               Directory holding rotated files (default: parent of activePath)
        outputDir=PATH                Event, dead-letter and metrics output (default /data/fortigate/parsed)
        checkpointPath=PATH           Checkpoint document (default <outputDir>/checkpoint.json)
        metricsPath=PATH              Metrics summaries (default <outputDir>/metrics.jsonl)
        eventsPrefix=NAME             Event file prefix (default events)
        dlqPrefix=NAME                Dead-letter file prefix (default dlq)
        tailSliceMillis=N             Active-file slice per loop iteration (default 2000)
        checkpointIntervalMillis=N    Checkpoint flush interval (default 2000)
        metricsIntervalMillis=N       Metrics summary interval (default 10000)
        pollIntervalMillis=N          Sleep when the active file has no new data (default 200)
        readChunkBytes=N              Read size (default 8192)
        completedLedgerCap=N          Completed rotated files remembered (default 5000)
        metricsExporter=otlp|none     OpenTelemetry export (default none)
        otelEndpoint=URL              OTLP endpoint
        otelResourceAttributes=K=V,.. Extra resource attributes
        logLevel=LEVEL                Root log level
        --dry-run                     Validate configuration and print the plan
        --verbose                     Enable DEBUG logging
        --help                        Show this message
      """;

  private IngestCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the ingest loop, or prints the plan with {@code --dry-run}.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (!input.words().isEmpty()) {
      log.error("Unexpected argument: {}", input.words().get(0));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    IngestConfig config;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      config = ConfigCliUtils.resolveIngestConfig(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (NoSuchFileException ex) {
      log.error("Configuration file not found: {}", ex.getFile());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      IngestUseCase useCase;
      try {
        useCase = new CompositionRoot(config, metrics, new SystemClockAdapter(), ZoneId.systemDefault())
            .ingestUseCase();
      } catch (IllegalArgumentException ex) {
        log.error("Unable to prepare output locations: {}", ex.getMessage());
        return ExitCode.INVALID_ARGS;
      }
      return runUntilStopped(useCase, config);
    }
  }

  private static ExitCode runUntilStopped(IngestUseCase useCase, IngestConfig config) {
    Thread loopThread = Thread.currentThread();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; stopping ingest loop");
      loopThread.interrupt();
      try {
        if (!finished.await(SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
          log.warn("Ingest loop did not stop within {} ms", SHUTDOWN_GRACE_MILLIS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "edge-ingest-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      log.info("Starting ingest of {} into {}", config.activePath(), config.outputDir());
      useCase.run();
      log.info("Ingest loop stopped");
      return Thread.currentThread().isInterrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    } catch (CheckpointException ex) {
      log.error("Checkpoint {} is unusable; fix or move it aside and restart", config.checkpointPath(), ex);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Ingest I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in ingest loop", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook stays registered");
    }
  }

  private static void printDryRunPlan(IngestConfig config) {
    CliPrinter.printLines(
        "Ingest dry-run: nothing will be read or written.",
        " Active file        : " + config.activePath(),
        " Rotated dir        : " + config.rotatedDir(),
        " Rotated pattern    : " + config.rotatedNamePattern().pattern(),
        " Output dir         : " + config.outputDir(),
        " Event files        : " + config.eventsPrefix() + "-YYYYMMDD-HH.jsonl",
        " Dead-letter files  : " + config.dlqPrefix() + "-YYYYMMDD-HH.jsonl",
        " Checkpoint         : " + config.checkpointPath(),
        " Metrics            : " + config.metricsPath(),
        " Tail slice (ms)    : " + config.tailSliceMillis(),
        " Checkpoint (ms)    : " + config.checkpointIntervalMillis(),
        " Metrics (ms)       : " + config.metricsIntervalMillis(),
        " Poll (ms)          : " + config.pollIntervalMillis(),
        " Read chunk (bytes) : " + config.readChunkBytes(),
        " Ledger cap         : " + config.completedLedgerCap(),
        " Re-run without --dry-run to start ingesting.");
  }
}
