package ca.gc.cra.edgeingest.api;

import ca.gc.cra.edgeingest.application.port.CheckpointException;
import ca.gc.cra.edgeingest.config.IngestConfig;
import ca.gc.cra.edgeingest.domain.checkpoint.ActivePointer;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.checkpoint.CompletedFileRecord;
import ca.gc.cra.edgeingest.domain.checkpoint.CounterSnapshot;
import ca.gc.cra.edgeingest.infrastructure.checkpoint.FileCheckpointStore;
import ca.gc.cra.edgeingest.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.edgeingest.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code inspect}: prints the persisted checkpoint without modifying it.
 *
 * @since 0.1.0
 */
public final class CheckpointInspectCli {
  private static final Logger log = LoggerFactory.getLogger(CheckpointInspectCli.class);
  private static final int DEFAULT_RECENT = 5;
  private static final String SUMMARY_USAGE =
      "usage: inspect [config=PATH] [checkpointPath=PATH | outputDir=PATH] [recent=N]";
  private static final String HELP_TEXT = """
      Checkpoint inspector

      Usage:
        inspect [options]

      Options:
        config=PATH           YAML file, as for run
        checkpointPath=PATH   Checkpoint document (default <outputDir>/checkpoint.json)
        outputDir=PATH        Output directory holding checkpoint.json
        recent=N              Completed rotated files to list, newest last (default 5)
        --help                Show this message
      """;

  private CheckpointInspectCli() {}

  /**
   * Prints the checkpoint summary.
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

    IngestConfig config;
    int recent;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      String recentRaw = kv.remove("recent");
      recent = recentRaw == null ? DEFAULT_RECENT : Integer.parseInt(recentRaw.trim());
      if (recent < 0) {
        throw new IllegalArgumentException("recent must be >= 0");
      }
      config = ConfigCliUtils.resolveIngestConfig(kv);
    } catch (NumberFormatException ex) {
      log.error("recent must be an integer");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (NoSuchFileException ex) {
      log.error("Configuration file not found: {}", ex.getFile());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.CONFIG_ERROR;
    }

    if (!Files.exists(config.checkpointPath())) {
      CliPrinter.println("No checkpoint at " + config.checkpointPath());
      return ExitCode.SUCCESS;
    }
    FileCheckpointStore store = new FileCheckpointStore(
        config.checkpointPath(),
        config.activePath().toString(),
        config.completedLedgerCap(),
        new SystemClockAdapter());
    try {
      print(config, store.load(), recent);
      return ExitCode.SUCCESS;
    } catch (CheckpointException ex) {
      log.error("Checkpoint {} is unreadable: {}", config.checkpointPath(), ex.getMessage());
      return ExitCode.IO_ERROR;
    }
  }

  private static void print(IngestConfig config, CheckpointState state, int recent) {
    ActivePointer active = state.active();
    CounterSnapshot counters = state.counters().snapshot();
    CliPrinter.printLines(
        "Checkpoint " + config.checkpointPath(),
        " Schema version     : " + state.schemaVersion(),
        " Updated at         : " + Instant.ofEpochSecond(state.updatedAt()),
        " Active path        : " + active.path(),
        " Active inode       : " + (active.inode() == null ? "<none>" : active.inode()),
        " Active offset      : " + active.offset(),
        " Last event ts      : " + (active.lastEventTsSeen() == null ? "<none>" : active.lastEventTsSeen()),
        " Completed files    : " + state.completedCount(),
        " Lines in           : " + counters.linesIn(),
        " Bytes in           : " + counters.bytesIn(),
        " Events out         : " + counters.eventsOut(),
        " DLQ out            : " + counters.dlqOut(),
        " Parse failures     : " + counters.parseFail(),
        " Write failures     : " + counters.writeFail(),
        " Checkpoint failures: " + counters.checkpointFail());
    List<CompletedFileRecord> completed = state.completed();
    int from = Math.max(0, completed.size() - recent);
    for (CompletedFileRecord record : completed.subList(from, completed.size())) {
      CliPrinter.println("  completed " + record.path() + " size=" + record.size()
          + " at " + Instant.ofEpochSecond(record.completedAt()));
    }
  }
}
