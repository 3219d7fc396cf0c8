package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.domain.file.SourceLine;
import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Pull-based, non-restartable stream of lines read from one physical file.
 * <p><strong>Role:</strong> Returned by {@link RotatedFileCatalogPort#readLines} (finite) and
 * {@link ActiveFilePort#follow} (unbounded).</p>
 * <p><strong>Thread-safety:</strong> Single-threaded polling.</p>
 *
 * @implNote Callers must always call {@link #close()} to release the file handle.
 * @since 0.1.0
 */
public interface LineCursor extends AutoCloseable {
  /**
   * Retrieves the next complete line.
   *
   * @return next line; empty when the cursor is exhausted, or, for unbounded cursors, when no complete line
   *     became available within one poll interval
   * @throws IOException if reading the underlying file fails
   */
  Optional<SourceLine> poll() throws IOException;

  /**
   * Indicates whether the cursor will never deliver another line.
   *
   * @return {@code true} once a finite cursor reached end of file
   */
  default boolean isExhausted() {
    return false;
  }

  @Override
  void close() throws IOException;
}
