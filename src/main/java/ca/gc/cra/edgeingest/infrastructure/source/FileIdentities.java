package ca.gc.cra.edgeingest.infrastructure.source;

import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.TimeUnit;

/**
 * Reads {@link FileIdentity} values from the file system.
 *
 * <p>The inode comes from the {@code unix:ino} attribute. Where that view is unavailable the hash of the
 * platform file key stands in; it is stable for the lifetime of a file but is not a real inode.</p>
 *
 * @since 0.1.0
 */
public final class FileIdentities {
  private FileIdentities() {}

  /**
   * States {@code path}.
   *
   * @param path file to state
   * @return identity labelled with {@code path.toString()}
   * @throws java.nio.file.NoSuchFileException if the file does not exist
   * @throws IOException if attributes cannot be read
   */
  public static FileIdentity stat(Path path) throws IOException {
    BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
    long mtime = attrs.lastModifiedTime().to(TimeUnit.SECONDS);
    return new FileIdentity(path.toString(), inodeOf(path, attrs), attrs.size(), mtime);
  }

  private static long inodeOf(Path path, BasicFileAttributes attrs) throws IOException {
    if (path.getFileSystem().supportedFileAttributeViews().contains("unix")
        && Files.getAttribute(path, "unix:ino") instanceof Number ino) {
      return ino.longValue();
    }
    Object key = attrs.fileKey();
    return key == null ? path.toAbsolutePath().hashCode() : key.hashCode();
  }
}
