package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.domain.event.DlqRecord;
import java.io.IOException;

/**
 * Append-only destination for lines the parser rejected.
 *
 * @since 0.1.0
 */
public interface DeadLetterSinkPort extends AutoCloseable {
  /**
   * Appends one dead-letter record.
   *
   * @param record rejected line with its reason and full source position
   * @throws IOException if the record could not be written
   */
  void append(DlqRecord record) throws IOException;

  @Override
  default void close() throws IOException {}
}
