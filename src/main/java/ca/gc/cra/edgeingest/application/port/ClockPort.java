package ca.gc.cra.edgeingest.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the ingest loop.
 * <p><strong>Why:</strong> Loop timers, ingest timestamps and hourly sink buckets read time through this
 * port so tests can substitute a deterministic clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.edgeingest.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();
}
