package ca.gc.cra.edgeingest.domain.checkpoint;

/**
 * Point-in-time copy of the process-wide {@link Counters}.
 *
 * @param linesIn lines read from any source
 * @param bytesIn bytes read from any source
 * @param eventsOut events written to the event sink
 * @param dlqOut records written to the dead-letter sink
 * @param parseFail lines rejected by the parser and written to the dead-letter sink
 * @param writeFail sink writes that failed (events, dead letters, metrics)
 * @param checkpointFail checkpoint flushes that failed
 * @since 0.1.0
 */
public record CounterSnapshot(
    long linesIn,
    long bytesIn,
    long eventsOut,
    long dlqOut,
    long parseFail,
    long writeFail,
    long checkpointFail) {

  /** All counters at zero. */
  public static final CounterSnapshot ZERO = new CounterSnapshot(0, 0, 0, 0, 0, 0, 0);

  public CounterSnapshot {
    if (linesIn < 0 || bytesIn < 0 || eventsOut < 0 || dlqOut < 0
        || parseFail < 0 || writeFail < 0 || checkpointFail < 0) {
      throw new IllegalArgumentException("counters must be non-negative");
    }
  }

  /**
   * Returns the per-field difference {@code this - earlier}.
   *
   * @param earlier older snapshot of the same monotonic counters
   * @return deltas; never negative for monotonic inputs
   */
  public CounterSnapshot minus(CounterSnapshot earlier) {
    return new CounterSnapshot(
        linesIn - earlier.linesIn,
        bytesIn - earlier.bytesIn,
        eventsOut - earlier.eventsOut,
        dlqOut - earlier.dlqOut,
        parseFail - earlier.parseFail,
        writeFail - earlier.writeFail,
        checkpointFail - earlier.checkpointFail);
  }
}
