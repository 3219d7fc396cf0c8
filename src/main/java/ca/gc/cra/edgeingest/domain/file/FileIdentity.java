package ca.gc.cra.edgeingest.domain.file;

import java.util.Objects;

/**
 * <strong>What:</strong> Composite identity of one physical log file at the moment it was stated.
 * <p><strong>Why:</strong> A path can name different physical files over time (rotation, recreation), so
 * dedup and resume decisions key on identity rather than on the path alone.</p>
 * <p><strong>Role:</strong> Domain value object shared by the catalog, tailer, and checkpoint ledger.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param path absolute or configured path string the file was observed under
 * @param inode inode number, or the closest platform equivalent
 * @param size file size in bytes when stated
 * @param mtimeSeconds modification time truncated to whole epoch seconds
 * @since 0.1.0
 */
public record FileIdentity(String path, long inode, long size, long mtimeSeconds) {

  /**
   * Validates the identity fields.
   *
   * @throws NullPointerException if {@code path} is {@code null}
   * @throws IllegalArgumentException if {@code size} is negative
   */
  public FileIdentity {
    Objects.requireNonNull(path, "path");
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0 (was " + size + ')');
    }
  }

  /**
   * Returns the ledger dedup key {@code path|inode|size|mtime}.
   *
   * <p>Including size and mtime guards against inode reuse after a file is deleted and another is
   * created with the same inode number.</p>
   *
   * @return dedup key; pure function of the record fields
   */
  public String dedupKey() {
    return path + '|' + inode + '|' + size + '|' + mtimeSeconds;
  }

  /**
   * Indicates whether {@code other} denotes the same physical file as this identity, ignoring growth.
   *
   * @param other identity to compare; may be {@code null}
   * @return {@code true} when both identities carry the same inode
   */
  public boolean samePhysicalFile(FileIdentity other) {
    return other != null && other.inode == inode;
  }
}
