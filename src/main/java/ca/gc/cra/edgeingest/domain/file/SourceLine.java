package ca.gc.cra.edgeingest.domain.file;

import java.util.Objects;

/**
 * One decoded line together with its encoded length and source position.
 *
 * @param text decoded line including its trailing line feed when one was read
 * @param byteLength number of bytes the line occupied in the source, terminator included
 * @param position where the line was read from
 * @since 0.1.0
 */
public record SourceLine(String text, int byteLength, SourcePosition position) {

  public SourceLine {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(position, "position");
    if (byteLength < 0) {
      throw new IllegalArgumentException("byteLength must be >= 0");
    }
  }
}
