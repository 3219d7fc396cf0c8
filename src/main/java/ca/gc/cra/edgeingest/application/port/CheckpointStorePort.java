package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import java.io.IOException;

/**
 * <strong>What:</strong> Port persisting the single {@link CheckpointState} owned by the ingest loop.
 * <p><strong>Why:</strong> The checkpoint is the only record of what has been processed; resuming after a
 * crash needs nothing else.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code FileCheckpointStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return a default-initialized state on first run.</li>
 *   <li>Replace the persisted document atomically so readers never observe a partial write.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the single ingest loop thread only.</p>
 *
 * @since 0.1.0
 */
public interface CheckpointStorePort {
  /**
   * Loads the persisted state.
   *
   * @return persisted state, or a default-initialized state when nothing has been persisted yet
   * @throws CheckpointException if the document exists but is unreadable or has an unsupported schema
   */
  CheckpointState load() throws CheckpointException;

  /**
   * Durably replaces the persisted state. Stamps {@link CheckpointState#touch(long)} before writing.
   *
   * @param state state to persist; must not be {@code null}
   * @throws IOException if the temporary file cannot be written, forced or renamed; the previous document
   *     is left intact
   */
  void save(CheckpointState state) throws IOException;
}
