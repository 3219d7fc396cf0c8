package ca.gc.cra.edgeingest.domain.event;

import ca.gc.cra.edgeingest.domain.file.SourcePosition;
import java.util.Objects;

/**
 * A line the parser could not use, routed to the dead-letter sink.
 *
 * @param reason why the line was rejected
 * @param raw raw line exactly as read
 * @param source full source position of the line
 * @param ingestTs ingestion wall-clock time, ISO-8601 with offset
 * @since 0.1.0
 */
public record DlqRecord(DlqReason reason, String raw, SourcePosition source, String ingestTs) {

  /** Schema version written with every dead-letter record. */
  public static final int SCHEMA_VERSION = 1;

  public DlqRecord {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(ingestTs, "ingestTs");
  }
}
