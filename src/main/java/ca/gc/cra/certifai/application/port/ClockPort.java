package ca.gc.cra.certifai.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock instants to lifecycle transitions.
 * <p><strong>Why:</strong> Timestamps end up in history entries, reviewer records and registry entries; tests
 * inject fixed clocks to assert on them.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.certifai.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock instant, subject to system clock adjustments
   */
  Instant now();

  /** Default {@link ClockPort} using {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
