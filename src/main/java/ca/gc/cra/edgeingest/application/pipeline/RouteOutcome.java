package ca.gc.cra.edgeingest.application.pipeline;

/**
 * Result of routing one parsed line.
 *
 * @since 0.1.0
 */
public enum RouteOutcome {
  /** Event appended to the event sink. */
  EVENT_WRITTEN,
  /** Rejected line appended to the dead-letter sink. */
  DLQ_WRITTEN,
  /** Sink rejected the write; the record was counted and dropped. */
  WRITE_FAILED
}
