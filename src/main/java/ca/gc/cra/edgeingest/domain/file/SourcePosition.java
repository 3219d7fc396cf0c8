package ca.gc.cra.edgeingest.domain.file;

import java.util.Objects;

/**
 * Where a line came from: path, file identity, and byte offset.
 *
 * <p>Offsets are {@code null} for compressed rotated files, where a byte position in the decompressed
 * stream has no meaning for resume. {@code size} and {@code mtime} are only known for rotated files and
 * are {@code null} for lines read from the active file.</p>
 *
 * @param path path of the file the line was read from
 * @param inode inode captured when the line was read; {@code null} when unknown
 * @param offset byte offset; {@code null} when unknown
 * @param size size of the rotated file when stated; {@code null} for the active file
 * @param mtime modification time (epoch seconds) of the rotated file; {@code null} for the active file
 * @since 0.1.0
 */
public record SourcePosition(String path, Long inode, Long offset, Long size, Long mtime) {

  public SourcePosition {
    Objects.requireNonNull(path, "path");
  }

  /**
   * Creates a position for a line read from the active file.
   *
   * @param path active file path
   * @param inode inode of the file handle the line was read through
   * @param offset byte offset after the line
   * @return active-file position
   */
  public static SourcePosition active(String path, long inode, long offset) {
    return new SourcePosition(path, inode, offset, null, null);
  }

  /**
   * Creates a position for a line read from a rotated file.
   *
   * @param identity identity of the rotated file
   * @param offset byte offset of the line start, or {@code null} for compressed files
   * @return rotated-file position
   */
  public static SourcePosition rotated(FileIdentity identity, Long offset) {
    return new SourcePosition(
        identity.path(), identity.inode(), offset, identity.size(), identity.mtimeSeconds());
  }

  /**
   * Drops {@code size} and {@code mtime}, keeping {@code path}, {@code inode} and {@code offset}.
   *
   * @return abbreviated position stamped onto events
   */
  public SourcePosition abbreviated() {
    if (size == null && mtime == null) {
      return this;
    }
    return new SourcePosition(path, inode, offset, null, null);
  }
}
