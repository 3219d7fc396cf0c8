package ca.gc.cra.edgeingest.infrastructure.source;

import java.util.Arrays;

/**
 * Byte-level line splitter that keeps partial lines buffered across reads.
 *
 * <p>Lines are split on {@code '\n'} only; a {@code '\r'} before it stays part of the line. Returned lines
 * include their terminator so byte offsets and content hashes cover exactly what was read.</p>
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
final class LineSplitter {
  private byte[] buffer;
  private int start;
  private int end;
  private int scan;

  LineSplitter(int initialCapacity) {
    this.buffer = new byte[Math.max(64, initialCapacity)];
  }

  /**
   * Appends freshly read bytes.
   *
   * @param data source array
   * @param offset first byte to copy
   * @param length number of bytes to copy
   */
  void feed(byte[] data, int offset, int length) {
    if (length <= 0) {
      return;
    }
    ensureCapacity(length);
    System.arraycopy(data, offset, buffer, end, length);
    end += length;
  }

  /**
   * Removes the next complete line.
   *
   * @return line bytes including the trailing {@code '\n'}, or {@code null} when no complete line is buffered
   */
  byte[] nextLine() {
    while (scan < end) {
      if (buffer[scan++] == '\n') {
        byte[] line = Arrays.copyOfRange(buffer, start, scan);
        start = scan;
        return line;
      }
    }
    return null;
  }

  /**
   * Removes whatever is buffered after the last line feed.
   *
   * @return trailing partial line, or {@code null} when nothing is buffered
   */
  byte[] drainPartial() {
    if (start == end) {
      return null;
    }
    byte[] rest = Arrays.copyOfRange(buffer, start, end);
    start = end;
    scan = end;
    return rest;
  }

  private void ensureCapacity(int extra) {
    if (end + extra <= buffer.length) {
      return;
    }
    int pending = end - start;
    if (pending + extra <= buffer.length && start > 0) {
      System.arraycopy(buffer, start, buffer, 0, pending);
    } else {
      byte[] grown = new byte[Math.max(buffer.length * 2, pending + extra)];
      System.arraycopy(buffer, start, grown, 0, pending);
      buffer = grown;
    }
    scan -= start;
    end = pending;
    start = 0;
  }
}
