package ca.gc.cra.edgeingest.infrastructure.source;

import ca.gc.cra.edgeingest.application.port.ActiveFilePort;
import ca.gc.cra.edgeingest.application.port.ActiveFileReplacedException;
import ca.gc.cra.edgeingest.application.port.LineCursor;
import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import ca.gc.cra.edgeingest.domain.file.SourceLine;
import ca.gc.cra.edgeingest.domain.file.SourcePosition;
import ca.gc.cra.edgeingest.domain.util.Utf8;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> {@link ActiveFilePort} following the growing active log file.
 * <p><strong>Why:</strong> Only complete lines are delivered; a partially written line stays buffered until
 * its line feed arrives, so the reported offset always sits on a line boundary.</p>
 * <p><strong>Thread-safety:</strong> Single-threaded.</p>
 *
 * @since 0.1.0
 */
public final class ActiveFileTailer implements ActiveFilePort {
  private final Path activePath;
  private final int chunkBytes;
  private final long pollIntervalMillis;

  /**
   * Creates a tailer.
   *
   * @param activePath active file path
   * @param chunkBytes read size
   * @param pollIntervalMillis sleep when no complete line is available
   */
  public ActiveFileTailer(Path activePath, int chunkBytes, long pollIntervalMillis) {
    this.activePath = Objects.requireNonNull(activePath, "activePath");
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.chunkBytes = chunkBytes;
    this.pollIntervalMillis = pollIntervalMillis;
  }

  @Override
  public Optional<FileIdentity> currentIdentity() throws IOException {
    try {
      return Optional.of(FileIdentities.stat(activePath));
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
  }

  @Override
  public LineCursor follow(FileIdentity identity, long startOffset) throws IOException {
    FileChannel channel = FileChannel.open(activePath, StandardOpenOption.READ);
    try {
      // The path may have been rotated after the caller's stat; the open channel must match that inode.
      FileIdentity opened = FileIdentities.stat(activePath);
      if (opened.inode() != identity.inode()) {
        throw new ActiveFileReplacedException(activePath.toString(), identity.inode(), opened.inode());
      }
      channel.position(startOffset);
    } catch (IOException ex) {
      channel.close();
      throw ex;
    }
    return new TailCursor(channel, identity, startOffset);
  }

  private final class TailCursor implements LineCursor {
    private final FileChannel channel;
    private final FileIdentity identity;
    private final ByteBuffer chunk = ByteBuffer.allocate(chunkBytes);
    private final LineSplitter splitter = new LineSplitter(chunkBytes * 2);
    private long offset;

    TailCursor(FileChannel channel, FileIdentity identity, long startOffset) {
      this.channel = channel;
      this.identity = identity;
      this.offset = startOffset;
    }

    @Override
    public Optional<SourceLine> poll() throws IOException {
      while (true) {
        byte[] line = splitter.nextLine();
        if (line != null) {
          offset += line.length;
          return Optional.of(new SourceLine(
              Utf8.decode(line, 0, line.length),
              line.length,
              SourcePosition.active(identity.path(), identity.inode(), offset)));
        }
        chunk.clear();
        int read = channel.read(chunk);
        if (read <= 0) {
          starve();
          return Optional.empty();
        }
        splitter.feed(chunk.array(), 0, read);
      }
    }

    private void starve() {
      try {
        Thread.sleep(pollIntervalMillis);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }

    @Override
    public void close() throws IOException {
      channel.close();
    }
  }
}
