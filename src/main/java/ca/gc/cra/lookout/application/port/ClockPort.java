package ca.gc.cra.lookout.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the session monitor.
 * <p><strong>Why:</strong> The creation-tolerance window is measured from the instant watching starts;
 * tests inject fixed clocks to make that boundary deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.lookout.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
