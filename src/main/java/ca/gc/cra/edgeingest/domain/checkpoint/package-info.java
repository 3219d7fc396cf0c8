/**
 * <strong>Purpose:</strong> Persisted ingestion progress: active pointer, completed-file ledger, counters.
 * <p><strong>Pipeline role:</strong> Threaded by reference through every stage of one loop iteration.
 * <p><strong>Concurrency:</strong> Single owner; none of these types synchronize.
 * <p><strong>Invariants:</strong> counters never decrease; the active offset never regresses while the
 * inode is unchanged; the ledger keeps only the most recent entries up to its cap.
 *
 * @since 0.1.0
 */
package ca.gc.cra.edgeingest.domain.checkpoint;
