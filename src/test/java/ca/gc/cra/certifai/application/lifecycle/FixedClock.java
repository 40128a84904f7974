package ca.gc.cra.certifai.application.lifecycle;

import ca.gc.cra.certifai.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;

/**
 * Clock that only moves when told to.
 */
final class FixedClock implements ClockPort {
  private Instant now;

  FixedClock(Instant start) {
    this.now = start;
  }

  @Override
  public Instant now() {
    return now;
  }

  void advance(Duration step) {
    now = now.plus(step);
  }
}
