package ca.gc.cra.edgeingest.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for configuration and CLI flows.
 * <p><strong>Why:</strong> Catches unusable output locations at startup instead of as a stream of counted
 * sink failures once the loop is running.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem
 * semantics.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is reported
 * rather than followed.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a configured path, rejecting control characters.
   *
   * @param name parameter name used in diagnostics
   * @param raw textual path
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the value is blank, contains control characters or is not a valid path
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  /**
   * Ensures {@code path} is a writable directory, creating it (and its parents) when missing.
   *
   * @param path candidate directory; must not be {@code null}
   * @return real path of the directory
   * @throws IllegalArgumentException if the directory cannot be created, is not a directory or is not writable
   */
  public static Path ensureWritableDir(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }
}
