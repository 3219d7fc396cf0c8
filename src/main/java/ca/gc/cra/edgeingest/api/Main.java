package ca.gc.cra.edgeingest.api;

import ca.gc.cra.edgeingest.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the edge ingest agent.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: edge-ingest <run|inspect|parse> [options]";
  private static final String HELP_TEXT = """
      FortiGate edge ingest agent

      Usage:
        edge-ingest <command> [options]

      Commands:
        run       Follow the FortiGate log and write events, dead letters and metrics (run --help)
        inspect   Print a summary of the persisted checkpoint
        parse     Parse lines from a file or line=TEXT and print the resulting JSON

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

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
   * Dispatches to a command without terminating the JVM.
   *
   * @param args arguments; the first bare word names the command, everything else is passed through
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.words().isEmpty()) {
      if (input.help()) {
        CliPrinter.printBlock(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String commandWord = input.words().get(0);
    String[] delegateArgs = withoutFirst(args, commandWord);
    String command = commandWord.toLowerCase(Locale.ROOT);
    return switch (command) {
      case "run" -> IngestCli.run(delegateArgs);
      case "inspect" -> CheckpointInspectCli.run(delegateArgs);
      case "parse" -> ParseLineCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String word) {
    List<String> rest = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(word)) {
        removed = true;
        continue;
      }
      rest.add(arg);
    }
    return rest.toArray(String[]::new);
  }
}
