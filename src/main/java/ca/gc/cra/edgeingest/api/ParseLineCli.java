package ca.gc.cra.edgeingest.api;

import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.domain.event.ParseOutcome;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import ca.gc.cra.edgeingest.domain.parse.FortiGateLineParser;
import ca.gc.cra.edgeingest.infrastructure.sink.IngestJsonWriter;
import ca.gc.cra.edgeingest.infrastructure.source.FileIdentities;
import ca.gc.cra.edgeingest.infrastructure.source.RotatedFileCatalog;
import ca.gc.cra.edgeingest.logging.LoggingConfigurator;
import ca.gc.cra.edgeingest.validation.Numbers;
import ca.gc.cra.edgeingest.validation.Paths;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Year;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code parse}: runs lines through the FortiGate parser and prints one JSON object per line.
 *
 * <p>Nothing is written to the sinks or the checkpoint.</p>
 *
 * @since 0.1.0
 */
public final class ParseLineCli {
  private static final Logger log = LoggerFactory.getLogger(ParseLineCli.class);
  private static final int READ_CHUNK_BYTES = 8_192;
  private static final String SUMMARY_USAGE = "usage: parse (line=TEXT | file=PATH) [year=YYYY]";
  private static final String HELP_TEXT = """
      FortiGate line parser

      Usage:
        parse line=TEXT [year=YYYY]
        parse file=PATH [year=YYYY]

      Options:
        line=TEXT   Single raw syslog line
        file=PATH   File of raw lines; .gz files are decompressed
        year=YYYY   Year assumed for envelope dates (default: current year)
        --help      Show this message

      Parsed lines print as event JSON; rejected lines print {"dlq_reason":...,"raw":...}.
      """;

  private ParseLineCli() {}

  /**
   * Parses the requested lines.
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

    String line;
    Path file;
    int year;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      line = kv.get("line");
      String fileRaw = kv.get("file");
      if ((line == null) == (fileRaw == null)) {
        throw new IllegalArgumentException("exactly one of line= or file= is required");
      }
      file = fileRaw == null ? null : Paths.parse("file", fileRaw);
      String yearRaw = kv.get("year");
      year = yearRaw == null ? Year.now().getValue() : (int) Numbers.parseInRange("year", yearRaw, 1970, 9999);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (line != null) {
      CliPrinter.println(render(line, year));
      return ExitCode.SUCCESS;
    }
    try {
      parseFile(file, year);
      return ExitCode.SUCCESS;
    } catch (NoSuchFileException ex) {
      log.error("File not found: {}", file);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("Failed reading {}", file, ex);
      return ExitCode.IO_ERROR;
    }
  }

  private static void parseFile(Path file, int year) throws IOException {
    FileIdentity identity = FileIdentities.stat(file);
    // Any file qualifies here; the catalog pattern is only used for directory listing.
    RotatedFileCatalog reader = new RotatedFileCatalog(file.getParent(), Pattern.compile(".*"), READ_CHUNK_BYTES);
    try (LineCursor cursor = reader.readLines(identity)) {
      Optional<SourceLine> next;
      while ((next = cursor.poll()).isPresent()) {
        CliPrinter.println(render(next.get().text(), year));
      }
    }
  }

  static String render(String rawLine, int year) {
    ParseOutcome outcome = FortiGateLineParser.parse(rawLine, year);
    if (outcome instanceof ParseOutcome.Parsed parsed) {
      return IngestJsonWriter.parsedEvent(parsed.event());
    }
    return IngestJsonWriter.rejection(((ParseOutcome.Rejected) outcome).reason(), rawLine);
  }
}
