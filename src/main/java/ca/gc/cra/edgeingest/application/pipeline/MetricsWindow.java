package ca.gc.cra.edgeingest.application.pipeline;

import ca.gc.cra.edgeingest.domain.checkpoint.ActivePointer;
import ca.gc.cra.edgeingest.domain.checkpoint.CheckpointState;
import ca.gc.cra.edgeingest.domain.checkpoint.CounterSnapshot;

/**
 * Turns cumulative counters into per-window rates.
 *
 * <p>Each call to {@link #close(CheckpointState, long)} ends the current window and starts the next one at the
 * same instant. Not thread-safe; owned by the ingest loop.</p>
 *
 * @since 0.1.0
 */
public final class MetricsWindow {
  private CounterSnapshot windowStart;
  private long windowStartMillis;

  /**
   * Opens the first window.
   *
   * @param initial counters at the start of the window, typically those restored from the checkpoint
   * @param startMillis epoch milliseconds at the start of the window
   */
  public MetricsWindow(CounterSnapshot initial, long startMillis) {
    this.windowStart = initial;
    this.windowStartMillis = startMillis;
  }

  /**
   * Closes the current window and opens the next.
   *
   * @param state checkpoint state read for counters, active progress and ledger size
   * @param nowMillis epoch milliseconds at which the window closes
   * @return summary of the closed window
   */
  public MetricsSnapshot close(CheckpointState state, long nowMillis) {
    CounterSnapshot current = state.counters().snapshot();
    CounterSnapshot deltas = current.minus(windowStart);
    long elapsedMillis = Math.max(1L, nowMillis - windowStartMillis);
    double seconds = elapsedMillis / 1000.0;

    double dlqRatio = deltas.linesIn() == 0 ? 0.0 : (double) deltas.dlqOut() / deltas.linesIn();
    ActivePointer active = state.active();
    MetricsSnapshot snapshot = new MetricsSnapshot(
        nowMillis / 1000L,
        seconds,
        current,
        deltas,
        deltas.linesIn() / seconds,
        deltas.eventsOut() / seconds,
        dlqRatio,
        new MetricsSnapshot.ActiveView(
            active.path(), active.inode(), active.offset(), active.lastEventTsSeen()),
        state.completedCount(),
        state.updatedAt());

    windowStart = current;
    windowStartMillis = nowMillis;
    return snapshot;
  }
}
