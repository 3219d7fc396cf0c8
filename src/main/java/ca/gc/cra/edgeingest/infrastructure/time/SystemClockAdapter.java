package ca.gc.cra.edgeingest.infrastructure.time;

import ca.gc.cra.edgeingest.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}.
 *
 * <p>Wall-clock time is wanted here: sink hour buckets and {@code ingest_ts} must follow the host clock,
 * adjustments included.</p>
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
