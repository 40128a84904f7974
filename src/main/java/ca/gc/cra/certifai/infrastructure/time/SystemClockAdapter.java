package ca.gc.cra.certifai.infrastructure.time;

import ca.gc.cra.certifai.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, the system UTC clock by default.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over an explicit clock, typically {@link Clock#fixed} in tests.
   *
   * @param clock backing clock
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current instant.
   *
   * @return current instant
   * @implNote Delegates to {@link Clock#instant()} without smoothing.
   */
  @Override
  public Instant now() {
    return clock.instant();
  }
}
