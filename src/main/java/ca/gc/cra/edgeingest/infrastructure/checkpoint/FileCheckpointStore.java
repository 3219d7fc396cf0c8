package ca.gc.cra.edgeingest.infrastructure.checkpoint;

import ca.gc.cra.edgeingest.application.port.CheckpointException;
import ca.gc.cra.edgeingest.application.port.CheckpointStorePort;
import ca.gc.cra.edgeingest.application.port.ClockPort;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.infrastructure.json.JsonSupport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CheckpointStorePort} backed by one JSON file.
 * <p><strong>Why:</strong> A crash at any point must leave either the previous or the new complete document
 * on disk, never a truncated one.</p>
 * <p><strong>Role:</strong> Infrastructure adapter owned by the ingest loop.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write the document to a {@code .tmp} sibling, force it to stable storage, then rename it over the
 *   canonical path.</li>
 *   <li>Return a first-run state when no document exists.</li>
 *   <li>Reject unreadable documents and schema versions from newer releases.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class FileCheckpointStore implements CheckpointStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

  private final Path file;
  private final Path tempFile;
  private final String activePath;
  private final int ledgerCap;
  private final ClockPort clock;
  private final CheckpointJsonCodec codec;

  /**
   * Creates a store.
   *
   * @param file canonical checkpoint path
   * @param activePath configured active file path, used for first-run state
   * @param ledgerCap maximum completed-file ledger size
   * @param clock source of {@code updated_at}
   */
  public FileCheckpointStore(Path file, String activePath, int ledgerCap, ClockPort clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.tempFile = file.resolveSibling(file.getFileName() + ".tmp");
    this.activePath = Objects.requireNonNull(activePath, "activePath");
    this.ledgerCap = ledgerCap;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.codec = new CheckpointJsonCodec(new JsonSupport());
  }

  @Override
  public CheckpointState load() throws CheckpointException {
    String document;
    try {
      document = Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      log.info("No checkpoint at {}; starting from the beginning of {}", file, activePath);
      return CheckpointState.initial(activePath, nowSeconds(), ledgerCap);
    } catch (IOException ex) {
      throw new CheckpointException("Failed to read checkpoint " + file, ex);
    }

    CheckpointState state;
    try {
      state = codec.read(document, ledgerCap);
    } catch (RuntimeException ex) {
      throw new CheckpointException("Unreadable checkpoint " + file + ": " + ex.getMessage(), ex);
    }

    if (!state.active().path().equals(activePath)) {
      log.warn("Checkpoint active path {} differs from configured {}; active progress restarts at offset 0",
          state.active().path(), activePath);
      CheckpointState fresh = CheckpointState.initial(activePath, state.updatedAt(), ledgerCap);
      return new CheckpointState(
          state.schemaVersion(),
          fresh.active(),
          state.completed(),
          state.counters(),
          state.updatedAt(),
          ledgerCap);
    }
    log.info("Loaded checkpoint {} (inode={}, offset={}, completed={})",
        file, state.active().inode(), state.active().offset(), state.completedCount());
    return state;
  }

  @Override
  public void save(CheckpointState state) throws IOException {
    Objects.requireNonNull(state, "state");
    state.touch(nowSeconds());
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(4096);
    codec.write(state, buffer);

    try (FileChannel channel = FileChannel.open(tempFile,
        StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer bytes = ByteBuffer.wrap(buffer.toByteArray());
      while (bytes.hasRemaining()) {
        channel.write(bytes);
      }
      channel.force(true);
    }
    try {
      Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing in place", file);
      Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Returns the canonical checkpoint path.
   *
   * @return checkpoint file
   */
  public Path file() {
    return file;
  }

  private long nowSeconds() {
    return TimeUnit.MILLISECONDS.toSeconds(clock.nowMillis());
  }
}
