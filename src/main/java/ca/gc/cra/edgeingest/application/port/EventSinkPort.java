package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.domain.event.IngestedEvent;
import java.io.IOException;

/**
 * Append-only destination for successfully parsed events.
 *
 * @since 0.1.0
 */
public interface EventSinkPort extends AutoCloseable {
  /**
   * Appends one event.
   *
   * @param event event stamped with ingest time and source position
   * @throws IOException if the record could not be written; the caller counts and drops it
   */
  void append(IngestedEvent event) throws IOException;

  @Override
  default void close() throws IOException {}
}
