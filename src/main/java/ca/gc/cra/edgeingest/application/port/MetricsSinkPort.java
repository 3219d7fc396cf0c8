package ca.gc.cra.edgeingest.application.port;

import ca.gc.cra.edgeingest.application.pipeline.MetricsSnapshot;
import java.io.IOException;

/**
 * Destination for periodic throughput summaries.
 *
 * @since 0.1.0
 */
public interface MetricsSinkPort {
  /**
   * Appends one summary.
   *
   * @param snapshot summary of the last window
   * @throws IOException if the summary could not be written; counted as a write failure
   */
  void append(MetricsSnapshot snapshot) throws IOException;
}
