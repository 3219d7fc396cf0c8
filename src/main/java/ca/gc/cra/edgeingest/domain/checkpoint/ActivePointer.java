package ca.gc.cra.edgeingest.domain.checkpoint;

import java.util.Objects;

/**
 * <strong>What:</strong> Progress into the currently active (mutable, appended-to) log file.
 * <p><strong>Why:</strong> Lets the tailer resume at the exact byte after the last routed line following a
 * restart.</p>
 * <p><strong>Role:</strong> Mutable member of {@link CheckpointState}; mutated only by the ingest loop.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Track the inode the offset belongs to.</li>
 *   <li>Refuse offset regressions while the inode is unchanged.</li>
 *   <li>Reset the offset to zero whenever the inode changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; single owner.</p>
 *
 * @since 0.1.0
 */
public final class ActivePointer {
  private final String path;
  private Long inode;
  private long offset;
  private String lastEventTsSeen;

  /**
   * Creates a pointer.
   *
   * @param path active file path
   * @param inode inode the offset refers to; {@code null} when no file has been observed yet
   * @param offset byte offset into that inode; must be non-negative
   * @param lastEventTsSeen most recent resolved event timestamp; may be {@code null}
   */
  public ActivePointer(String path, Long inode, long offset, String lastEventTsSeen) {
    this.path = Objects.requireNonNull(path, "path");
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ')');
    }
    this.inode = inode;
    this.offset = offset;
    this.lastEventTsSeen = lastEventTsSeen;
  }

  /**
   * Creates the first-run pointer: unknown inode, offset zero.
   *
   * @param path active file path
   * @return fresh pointer
   */
  public static ActivePointer initial(String path) {
    return new ActivePointer(path, null, 0L, null);
  }

  public String path() {
    return path;
  }

  public Long inode() {
    return inode;
  }

  public long offset() {
    return offset;
  }

  public String lastEventTsSeen() {
    return lastEventTsSeen;
  }

  /**
   * Points at {@code currentInode}, resetting the offset to zero when it differs from the stored inode.
   *
   * @param currentInode inode currently found at the active path
   * @return {@code true} when the inode changed (including the first adoption)
   */
  public boolean adopt(long currentInode) {
    if (inode != null && inode == currentInode) {
      return false;
    }
    inode = currentInode;
    offset = 0L;
    return true;
  }

  /**
   * Restarts the current inode from offset zero after the file was truncated in place.
   */
  public void restartAfterTruncation() {
    offset = 0L;
  }

  /**
   * Moves the offset forward.
   *
   * @param newOffset offset after the last routed line
   * @throws IllegalStateException if {@code newOffset} is behind the current offset
   */
  public void advanceTo(long newOffset) {
    if (newOffset < offset) {
      throw new IllegalStateException(
          "active offset must not regress (" + offset + " -> " + newOffset + ')');
    }
    offset = newOffset;
  }

  /**
   * Records the most recent resolved event timestamp. Advisory only.
   *
   * @param eventTs ISO-8601 timestamp; ignored when {@code null}
   */
  public void recordEventTimestamp(String eventTs) {
    if (eventTs != null) {
      lastEventTsSeen = eventTs;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ActivePointer other)) {
      return false;
    }
    return offset == other.offset
        && path.equals(other.path)
        && Objects.equals(inode, other.inode)
        && Objects.equals(lastEventTsSeen, other.lastEventTsSeen);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, inode, offset, lastEventTsSeen);
  }

  @Override
  public String toString() {
    return "ActivePointer{path=" + path + ", inode=" + inode + ", offset=" + offset + '}';
  }
}
