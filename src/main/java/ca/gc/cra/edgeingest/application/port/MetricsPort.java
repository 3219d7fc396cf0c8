package ca.gc.cra.edgeingest.application.port;

/**
 * <strong>What:</strong> Port abstracting live metrics emission.
 * <p><strong>Why:</strong> Lets the ingest loop mirror its counters to a metrics backend without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} when export is off.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from the loop thread and the
 * shutdown hook.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code ingest.lines.in}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code ingest.dlq.out}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., line length in bytes)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
