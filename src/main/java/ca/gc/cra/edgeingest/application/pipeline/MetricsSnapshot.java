package ca.gc.cra.edgeingest.application.pipeline;

import ca.gc.cra.edgeingest.domain.checkpoint.CounterSnapshot;
import java.util.Objects;

/**
 * One periodic throughput summary, appended to the metrics sink.
 *
 * @param ts epoch seconds at which the window closed
 * @param windowSeconds length of the window
 * @param counters cumulative counters
 * @param deltas counter growth during the window
 * @param linesPerSec lines read per second during the window
 * @param eventsPerSec events written per second during the window
 * @param dlqRatio dead-lettered lines over lines read during the window; {@code 0} when idle
 * @param active active-file progress at window close
 * @param completedFiles rotated files currently in the completed ledger
 * @param checkpointUpdatedAt epoch seconds of the last successful checkpoint save
 * @since 0.1.0
 */
public record MetricsSnapshot(
    long ts,
    double windowSeconds,
    CounterSnapshot counters,
    CounterSnapshot deltas,
    double linesPerSec,
    double eventsPerSec,
    double dlqRatio,
    ActiveView active,
    int completedFiles,
    long checkpointUpdatedAt) {

  public MetricsSnapshot {
    Objects.requireNonNull(counters, "counters");
    Objects.requireNonNull(deltas, "deltas");
    Objects.requireNonNull(active, "active");
  }

  /**
   * Copy of the active pointer taken when the window closed.
   *
   * @param path active file path
   * @param inode inode being followed; {@code null} before the first tail slice
   * @param offset byte offset past the last routed line
   * @param lastEventTsSeen latest resolved event time written
   */
  public record ActiveView(String path, Long inode, long offset, String lastEventTsSeen) {}
}
