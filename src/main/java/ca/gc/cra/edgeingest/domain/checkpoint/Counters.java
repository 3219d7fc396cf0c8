package ca.gc.cra.edgeingest.domain.checkpoint;

import java.util.Objects;

/**
 * Monotonic, process-wide ingestion totals.
 *
 * <p>Every mutator only adds; there is no way to decrement or reset a counter. Not thread-safe: the
 * counters live inside {@link CheckpointState} and share its single owner.</p>
 *
 * @since 0.1.0
 */
public final class Counters {
  private long linesIn;
  private long bytesIn;
  private long eventsOut;
  private long dlqOut;
  private long parseFail;
  private long writeFail;
  private long checkpointFail;

  /** Creates zeroed counters. */
  public Counters() {
    this(CounterSnapshot.ZERO);
  }

  /**
   * Restores counters from a persisted snapshot.
   *
   * @param restored snapshot to continue counting from
   */
  public Counters(CounterSnapshot restored) {
    Objects.requireNonNull(restored, "restored");
    this.linesIn = restored.linesIn();
    this.bytesIn = restored.bytesIn();
    this.eventsOut = restored.eventsOut();
    this.dlqOut = restored.dlqOut();
    this.parseFail = restored.parseFail();
    this.writeFail = restored.writeFail();
    this.checkpointFail = restored.checkpointFail();
  }

  /**
   * Counts one line read from a source.
   *
   * @param byteLength encoded length of the line
   */
  public void recordLineIn(long byteLength) {
    if (byteLength < 0) {
      throw new IllegalArgumentException("byteLength must be >= 0");
    }
    linesIn++;
    bytesIn += byteLength;
  }

  public void recordEventOut() {
    eventsOut++;
  }

  /** Counts a dead-lettered line: both {@code dlq-out} and {@code parse-fail}. */
  public void recordDeadLetterOut() {
    dlqOut++;
    parseFail++;
  }

  public void recordWriteFailure() {
    writeFail++;
  }

  public void recordCheckpointFailure() {
    checkpointFail++;
  }

  /**
   * Copies the current totals.
   *
   * @return immutable snapshot
   */
  public CounterSnapshot snapshot() {
    return new CounterSnapshot(
        linesIn, bytesIn, eventsOut, dlqOut, parseFail, writeFail, checkpointFail);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Counters other && snapshot().equals(other.snapshot());
  }

  @Override
  public int hashCode() {
    return snapshot().hashCode();
  }

  @Override
  public String toString() {
    return "Counters" + snapshot();
  }
}
