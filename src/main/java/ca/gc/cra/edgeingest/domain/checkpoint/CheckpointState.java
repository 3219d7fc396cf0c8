package ca.gc.cra.edgeingest.domain.checkpoint;

import ca.gc.cra.edgeingest.domain.file.FileIdentity;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> The single unit of persisted ingestion progress.
 * <p><strong>Why:</strong> The pipeline is resumable from this state alone: the active pointer says where
 * to continue tailing, the completed-file ledger says which rotated files never need reading again, and the
 * counters carry process totals across restarts.</p>
 * <p><strong>Role:</strong> Domain aggregate owned by the ingest loop, loaded once at startup and saved
 * wholesale by a {@code CheckpointStorePort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer and record completed-file membership by dedup key.</li>
 *   <li>Cap the ledger to the most recently appended entries (FIFO by insertion).</li>
 *   <li>Expose the mutable {@link ActivePointer} and {@link Counters}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Exactly one logical thread mutates a given instance;
 * never copy it to share progress between components.</p>
 *
 * @since 0.1.0
 */
public final class CheckpointState {
  /** Schema version written by this release. */
  public static final int SCHEMA_VERSION = 1;
  /** Default number of completed-file entries retained. */
  public static final int DEFAULT_LEDGER_CAP = 5_000;

  private final int schemaVersion;
  private final ActivePointer active;
  private final Deque<CompletedFileRecord> completed = new ArrayDeque<>();
  private final Map<String, Integer> completedKeys = new HashMap<>();
  private final int ledgerCap;
  private final Counters counters;
  private long updatedAt;

  /**
   * Restores a state from persisted parts.
   *
   * @param schemaVersion persisted schema version
   * @param active active pointer
   * @param completed ledger entries, oldest first
   * @param counters restored counters
   * @param updatedAt epoch seconds of the last save
   * @param ledgerCap maximum ledger size; must be positive
   */
  public CheckpointState(
      int schemaVersion,
      ActivePointer active,
      List<CompletedFileRecord> completed,
      Counters counters,
      long updatedAt,
      int ledgerCap) {
    if (ledgerCap <= 0) {
      throw new IllegalArgumentException("ledgerCap must be positive");
    }
    this.schemaVersion = schemaVersion;
    this.active = Objects.requireNonNull(active, "active");
    this.counters = Objects.requireNonNull(counters, "counters");
    this.updatedAt = updatedAt;
    this.ledgerCap = ledgerCap;
    for (CompletedFileRecord record : Objects.requireNonNull(completed, "completed")) {
      append(record);
    }
  }

  /**
   * Creates the first-run state: pointer at offset zero of {@code activePath}, empty ledger, zero counters.
   *
   * @param activePath configured active file path
   * @param nowSeconds creation time in epoch seconds
   * @param ledgerCap maximum ledger size
   * @return fresh state
   */
  public static CheckpointState initial(String activePath, long nowSeconds, int ledgerCap) {
    return new CheckpointState(
        SCHEMA_VERSION, ActivePointer.initial(activePath), List.of(), new Counters(), nowSeconds, ledgerCap);
  }

  /**
   * Checks whether a rotated file with this identity has already been routed to completion.
   *
   * @param identity identity stated just before processing
   * @return {@code true} when the dedup key is present in the ledger
   */
  public boolean isCompleted(FileIdentity identity) {
    return completedKeys.containsKey(identity.dedupKey());
  }

  /**
   * Appends {@code identity} to the ledger and evicts the oldest entries beyond the cap.
   *
   * <p>Appending the same identity twice records two entries, matching the append-only ledger.</p>
   *
   * @param identity identity of the fully routed file
   * @param completedAt epoch seconds of completion
   */
  public void markCompleted(FileIdentity identity, long completedAt) {
    append(CompletedFileRecord.of(identity, completedAt));
  }

  private void append(CompletedFileRecord record) {
    completed.addLast(record);
    completedKeys.merge(record.key(), 1, Integer::sum);
    while (completed.size() > ledgerCap) {
      CompletedFileRecord evicted = completed.removeFirst();
      completedKeys.computeIfPresent(evicted.key(), (k, count) -> count > 1 ? count - 1 : null);
    }
  }

  public int schemaVersion() {
    return schemaVersion;
  }

  public ActivePointer active() {
    return active;
  }

  public Counters counters() {
    return counters;
  }

  /**
   * Returns the ledger, oldest entry first.
   *
   * @return immutable copy of the ledger
   */
  public List<CompletedFileRecord> completed() {
    return List.copyOf(completed);
  }

  public int completedCount() {
    return completed.size();
  }

  public int ledgerCap() {
    return ledgerCap;
  }

  public long updatedAt() {
    return updatedAt;
  }

  /**
   * Stamps the save time. Called by the checkpoint store immediately before serialization.
   *
   * @param epochSeconds save time
   */
  public void touch(long epochSeconds) {
    this.updatedAt = epochSeconds;
  }
}
