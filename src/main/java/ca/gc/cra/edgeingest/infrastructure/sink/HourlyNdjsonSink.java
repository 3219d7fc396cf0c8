package ca.gc.cra.edgeingest.infrastructure.sink;

import ca.gc.cra.edgeingest.application.port.ClockPort;
import ca.gc.cra.edgeingest.application.port.DeadLetterSinkPort;
import ca.gc.cra.edgeingest.application.port.EventSinkPort;
import ca.gc.cra.edgeingest.domain.event.DlqRecord;
import ca.gc.cra.edgeingest.domain.event.IngestedEvent;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends newline-delimited JSON records to hourly files named {@code <prefix>-YYYYMMDD-HH.jsonl}.
 *
 * <p>The hour bucket is taken from the clock at write time in the configured zone. The file for the current
 * hour stays open and is replaced when the hour changes. Every record is flushed before {@code append}
 * returns, so a crash loses at most the record being written.</p>
 * <p>Not thread-safe; owned by the ingest loop.</p>
 *
 * @since 0.1.0
 */
public final class HourlyNdjsonSink implements EventSinkPort, DeadLetterSinkPort {
  private static final Logger log = LoggerFactory.getLogger(HourlyNdjsonSink.class);
  private static final String HOUR_PATTERN = "uuuuMMdd-HH";

  private final Path directory;
  private final String prefix;
  private final ClockPort clock;
  private final DateTimeFormatter hourFormat;

  private String currentHour;
  private OutputStream out;

  /**
   * Creates a sink writing into {@code directory}.
   *
   * @param directory existing output directory
   * @param prefix file name prefix, e.g. {@code events}
   * @param clock source of the hour bucket
   * @param zone zone used to name hour buckets
   */
  public HourlyNdjsonSink(Path directory, String prefix, ClockPort clock, ZoneId zone) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.hourFormat = DateTimeFormatter.ofPattern(HOUR_PATTERN).withZone(Objects.requireNonNull(zone, "zone"));
  }

  @Override
  public void append(IngestedEvent event) throws IOException {
    writeLine(IngestJsonWriter.event(event));
  }

  @Override
  public void append(DlqRecord record) throws IOException {
    writeLine(IngestJsonWriter.deadLetter(record));
  }

  /**
   * Returns the file the sink would write to at {@code epochMillis}.
   *
   * @param epochMillis wall-clock time
   * @return hourly file path
   */
  public Path fileFor(long epochMillis) {
    return directory.resolve(prefix + '-' + hourFormat.format(Instant.ofEpochMilli(epochMillis)) + ".jsonl");
  }

  private void writeLine(byte[] json) throws IOException {
    long now = clock.nowMillis();
    String hour = hourFormat.format(Instant.ofEpochMilli(now));
    try {
      if (out == null || !hour.equals(currentHour)) {
        roll(hour, fileFor(now));
      }
      out.write(json);
      out.write('\n');
      out.flush();
    } catch (IOException ex) {
      discardStream();
      throw ex;
    }
  }

  private void roll(String hour, Path target) throws IOException {
    closeStream();
    out = new BufferedOutputStream(Files.newOutputStream(
        target, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND));
    currentHour = hour;
    log.debug("Opened {} sink file {}", prefix, target);
  }

  private void discardStream() {
    try {
      closeStream();
    } catch (IOException closeEx) {
      log.debug("Ignoring close failure on broken {} sink stream", prefix, closeEx);
    }
  }

  private void closeStream() throws IOException {
    OutputStream current = out;
    out = null;
    currentHour = null;
    if (current != null) {
      current.close();
    }
  }

  @Override
  public void close() throws IOException {
    closeStream();
  }
}
