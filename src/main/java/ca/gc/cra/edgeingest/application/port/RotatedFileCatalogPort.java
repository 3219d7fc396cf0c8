package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port discovering and reading rotated (closed, immutable) log files.
 * <p><strong>Why:</strong> Rotated files can be pruned externally at any time; the port surfaces a vanished
 * file as {@link java.nio.file.NoSuchFileException} so the caller can skip it.</p>
 * <p><strong>Role:</strong> Input port implemented by {@code RotatedFileCatalog}.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls.</p>
 *
 * @since 0.1.0
 */
public interface RotatedFileCatalogPort {
  /**
   * Lists rotated files oldest first.
   *
   * @return paths matching the rotation naming pattern, sorted by their embedded timestamp
   * @throws IOException if the rotation directory cannot be listed
   */
  List<Path> listRotatedFiles() throws IOException;

  /**
   * Captures the identity of a rotated file.
   *
   * @param path rotated file
   * @return identity at the time of the call
   * @throws java.nio.file.NoSuchFileException if the file vanished since listing
   * @throws IOException if attributes cannot be read
   */
  FileIdentity statFile(Path path) throws IOException;

  /**
   * Opens a finite cursor over every line of a rotated file, decompressing {@code .gz} files.
   *
   * @param identity identity captured by {@link #statFile(Path)}; stamped on every line's position
   * @return cursor positioned at the start of the file
   * @throws java.nio.file.NoSuchFileException if the file vanished since it was stated
   * @throws IOException if the file cannot be opened
   */
  LineCursor readLines(FileIdentity identity) throws IOException;
}
