package ca.gc.cra.edgeingest.application.pipeline;

import ca.gc.cra.edgeingest.application.port.ClockPort;
import ca.gc.cra.edgeingest.application.port.DeadLetterSinkPort;
import ca.gc.cra.edgeingest.application.port.EventSinkPort;
import ca.gc.cra.edgeingest.application.port.MetricsPort;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.checkpoint.Counters;
import ca.gc.cra.edgeingest.domain.event.DlqRecord;
import ca.gc.cra.edgeingest.domain.event.FirewallEvent;
import ca.gc.cra.edgeingest.domain.event.IngestedEvent;
import ca.gc.cra.edgeingest.domain.event.ParseOutcome;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import ca.gc.cra.edgeingest.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Sends each parse outcome to the event or dead-letter sink and keeps the counters.
 * <p><strong>Why:</strong> A failed write must never stop the loop: the record is counted as a write failure and
 * dropped, and the next line proceeds.</p>
 * <p><strong>Role:</strong> Application service invoked by {@link IngestUseCase} once per line.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stamp {@code ingest_ts} (UTC, millisecond precision, {@code +00:00} offset).</li>
 *   <li>Abbreviate the source position of events to path, inode and offset; dead letters keep all of it.</li>
 *   <li>Count events-out, dlq-out with parse-fail, or write-fail, and mirror them to {@link MetricsPort}.</li>
 *   <li>Record the latest resolved event time on the active pointer.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; mutates the loop-owned {@link CheckpointState}.</p>
 * <p><strong>Observability:</strong> {@code ingest.events.out}, {@code ingest.dlq.out}, {@code ingest.write.fail}.</p>
 *
 * @since 0.1.0
 */
public final class EventRouter {
  private static final Logger log = LoggerFactory.getLogger(EventRouter.class);
  static final DateTimeFormatter INGEST_TS =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSxxx").withZone(ZoneOffset.UTC);

  private final EventSinkPort events;
  private final DeadLetterSinkPort deadLetters;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a router.
   *
   * @param events sink for parsed events
   * @param deadLetters sink for rejected lines
   * @param clock source of ingest timestamps
   * @param metrics live metrics mirror
   */
  public EventRouter(
      EventSinkPort events, DeadLetterSinkPort deadLetters, ClockPort clock, MetricsPort metrics) {
    this.events = Objects.requireNonNull(events, "events");
    this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Routes one parse outcome.
   *
   * @param outcome parser result for {@code line}
   * @param line line as read, with its source position
   * @param state loop-owned checkpoint state whose counters and active pointer are updated
   * @return what happened to the record
   */
  public RouteOutcome route(ParseOutcome outcome, SourceLine line, CheckpointState state) {
    String ingestTs = INGEST_TS.format(Instant.ofEpochMilli(clock.nowMillis()));
    Counters counters = state.counters();

    if (outcome instanceof ParseOutcome.Parsed parsed) {
      FirewallEvent event = parsed.event();
      try {
        events.append(new IngestedEvent(event, ingestTs, line.position().abbreviated()));
      } catch (IOException ex) {
        return writeFailed(counters, "event", line, ex);
      }
      counters.recordEventOut();
      metrics.increment("ingest.events.out");
      state.active().recordEventTimestamp(event.eventTsIso());
      return RouteOutcome.EVENT_WRITTEN;
    }

    ParseOutcome.Rejected rejected = (ParseOutcome.Rejected) outcome;
    try {
      deadLetters.append(new DlqRecord(rejected.reason(), line.text(), line.position(), ingestTs));
    } catch (IOException ex) {
      return writeFailed(counters, "dead-letter", line, ex);
    }
    counters.recordDeadLetterOut();
    metrics.increment("ingest.dlq.out");
    if (log.isDebugEnabled()) {
      log.debug("Dead-lettered line ({}) at {}: {}",
          rejected.reason().code(), line.position().offset(), Logs.printable(line.text()));
    }
    return RouteOutcome.DLQ_WRITTEN;
  }

  private RouteOutcome writeFailed(Counters counters, String kind, SourceLine line, IOException ex) {
    counters.recordWriteFailure();
    metrics.increment("ingest.write.fail");
    log.warn("Dropping {} record from {} after sink write failure", kind, line.position().path(), ex);
    return RouteOutcome.WRITE_FAILED;
  }
}
