package ca.gc.cra.edgeingest.application.pipeline;

/**
 * Result of a checkpoint flush.
 *
 * @since 0.1.0
 */
public enum FlushOutcome {
  /** Checkpoint replaced atomically. */
  SAVED,
  /** Write failed; the in-memory state is kept and retried on the next tick. */
  FAILED
}
