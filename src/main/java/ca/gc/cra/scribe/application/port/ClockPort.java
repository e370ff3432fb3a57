package ca.gc.cra.scribe.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock instants to state history and component lifecycle
 * bookkeeping.
 * <p><strong>Why:</strong> Lets tests pin timestamps recorded in {@code StateChange} entries and component
 * metadata.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to call from the UI thread at any time.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.scribe.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock time; never {@code null}
   */
  Instant now();

  /** Default clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
