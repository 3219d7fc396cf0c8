package ca.gc.cra.edgeingest.infrastructure.source;

import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import ca.gc.cra.edgeingest.domain.file.SourcePosition;
import ca.gc.cra.edgeingest.domain.util.Utf8;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.zip.GZIPInputStream;

/**
 * Finite cursor over a rotated file, plain or gzip-compressed.
 *
 * <p>Plain files report the byte offset where each line starts. Compressed files report a {@code null}
 * offset since positions in the decompressed stream do not map onto the file. A final line without a
 * terminating line feed is still delivered.</p>
 *
 * @since 0.1.0
 */
final class RotatedFileLineCursor implements LineCursor {
  private final FileIdentity identity;
  private final InputStream in;
  private final boolean compressed;
  private final byte[] chunk;
  private final LineSplitter splitter;

  private long lineStart;
  private boolean eof;
  private boolean exhausted;

  private RotatedFileLineCursor(FileIdentity identity, InputStream in, boolean compressed, int chunkBytes) {
    this.identity = identity;
    this.in = in;
    this.compressed = compressed;
    this.chunk = new byte[chunkBytes];
    this.splitter = new LineSplitter(chunkBytes * 2);
  }

  /**
   * Opens {@code identity.path()}.
   *
   * @param identity identity stated just before opening
   * @param chunkBytes read size
   * @return cursor at the first line
   * @throws java.nio.file.NoSuchFileException if the file vanished
   * @throws IOException if the file cannot be opened or its gzip header is invalid
   */
  static RotatedFileLineCursor open(FileIdentity identity, int chunkBytes) throws IOException {
    Path path = Path.of(identity.path());
    boolean compressed = identity.path().endsWith(".gz");
    InputStream raw = Files.newInputStream(path);
    if (!compressed) {
      return new RotatedFileLineCursor(identity, raw, false, chunkBytes);
    }
    try {
      return new RotatedFileLineCursor(identity, new GZIPInputStream(raw, chunkBytes), true, chunkBytes);
    } catch (IOException ex) {
      raw.close();
      throw ex;
    }
  }

  @Override
  public Optional<SourceLine> poll() throws IOException {
    if (exhausted) {
      return Optional.empty();
    }
    while (true) {
      byte[] line = splitter.nextLine();
      if (line != null) {
        return Optional.of(emit(line));
      }
      if (eof) {
        byte[] rest = splitter.drainPartial();
        exhausted = true;
        return rest == null ? Optional.empty() : Optional.of(emit(rest));
      }
      int read = in.read(chunk);
      if (read < 0) {
        eof = true;
      } else {
        splitter.feed(chunk, 0, read);
      }
    }
  }

  private SourceLine emit(byte[] bytes) {
    Long offset = compressed ? null : lineStart;
    lineStart += bytes.length;
    return new SourceLine(
        Utf8.decode(bytes, 0, bytes.length), bytes.length, SourcePosition.rotated(identity, offset));
  }

  @Override
  public boolean isExhausted() {
    return exhausted;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }
}
