package ca.gc.cra.edgeingest.application.port;

import java.io.IOException;

/**
 * Raised when the file opened at the active path is no longer the one the caller stat'ed, because a
 * rotation landed between the identity check and the open. The caller re-reads the identity and adopts
 * the new file.
 *
 * @since 0.1.0
 */
public final class ActiveFileReplacedException extends IOException {
  private final long expectedInode;
  private final long openedInode;

  /**
   * Creates an exception naming both inodes.
   *
   * @param path active path
   * @param expectedInode inode the caller asked to follow
   * @param openedInode inode actually found after opening
   */
  public ActiveFileReplacedException(String path, long expectedInode, long openedInode) {
    super("Active file " + path + " was replaced before open (inode " + expectedInode + " -> " + openedInode + ")");
    this.expectedInode = expectedInode;
    this.openedInode = openedInode;
  }

  public long expectedInode() { return expectedInode; }

  public long openedInode() { return openedInode; }
}
