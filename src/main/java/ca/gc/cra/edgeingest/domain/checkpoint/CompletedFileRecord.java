package ca.gc.cra.edgeingest.domain.checkpoint;

import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import java.util.Objects;

/**
 * Ledger entry for a rotated file that was routed to completion.
 *
 * @param key dedup key {@code path|inode|size|mtime}
 * @param path rotated file path
 * @param inode inode of the rotated file
 * @param size size in bytes when it was completed
 * @param mtime modification time in epoch seconds
 * @param completedAt epoch seconds when the file was marked completed
 * @since 0.1.0
 */
public record CompletedFileRecord(
    String key, String path, long inode, long size, long mtime, long completedAt) {

  public CompletedFileRecord {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(path, "path");
  }

  /**
   * Builds a ledger entry from a file identity.
   *
   * @param identity identity of the completed file
   * @param completedAt epoch seconds of completion
   * @return ledger entry
   */
  public static CompletedFileRecord of(FileIdentity identity, long completedAt) {
    return new CompletedFileRecord(
        identity.dedupKey(),
        identity.path(),
        identity.inode(),
        identity.size(),
        identity.mtimeSeconds(),
        completedAt);
  }
}
