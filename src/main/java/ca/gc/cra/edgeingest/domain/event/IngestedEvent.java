package ca.gc.cra.edgeingest.domain.event;

import ca.gc.cra.edgeingest.domain.file.SourcePosition;
import java.util.Objects;

/**
 * A parsed event stamped with ingestion metadata, ready for the event sink.
 *
 * @param event parsed event
 * @param ingestTs ingestion wall-clock time, ISO-8601 with offset
 * @param source abbreviated source position ({@code path}, {@code inode}, {@code offset})
 * @since 0.1.0
 */
public record IngestedEvent(FirewallEvent event, String ingestTs, SourcePosition source) {

  public IngestedEvent {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(ingestTs, "ingestTs");
    Objects.requireNonNull(source, "source");
  }
}
