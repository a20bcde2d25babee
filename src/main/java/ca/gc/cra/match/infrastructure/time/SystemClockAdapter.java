package ca.gc.cra.match.infrastructure.time;

import ca.gc.cra.match.application.port.ClockPort;

/**
 * {@link ClockPort} backed by {@link System#currentTimeMillis()}; stamps {@code run_timestamp}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
