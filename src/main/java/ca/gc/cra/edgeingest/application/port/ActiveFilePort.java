package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import java.io.IOException;
import java.util.Optional;

/**
 * <strong>What:</strong> Port following the single, still-growing active log file.
 * <p><strong>Why:</strong> Identity checks are kept separate from the follow loop so the orchestrator can
 * detect rotation and truncation between reads.</p>
 * <p><strong>Role:</strong> Input port implemented by {@code ActiveFileTailer}.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded.</p>
 *
 * @since 0.1.0
 */
public interface ActiveFilePort {
  /**
   * Returns the identity currently found at the active path.
   *
   * @return identity, or empty when no file exists at the active path
   * @throws IOException if attributes cannot be read for another reason
   */
  Optional<FileIdentity> currentIdentity() throws IOException;

  /**
   * Opens an unbounded cursor at {@code startOffset}. Positions report the offset just past each line.
   * When starved the cursor sleeps one poll interval and returns empty rather than ending.
   *
   * @param identity identity the caller believes the active path denotes; stamped on every position
   * @param startOffset byte offset to resume from
   * @return cursor; never exhausted
   * @throws java.nio.file.NoSuchFileException if the active file disappeared
   * @throws ActiveFileReplacedException if the opened file is not {@code identity}'s inode
   * @throws IOException if the file cannot be opened or positioned
   */
  LineCursor follow(FileIdentity identity, long startOffset) throws IOException;
}
