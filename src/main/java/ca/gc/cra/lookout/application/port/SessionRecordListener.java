package ca.gc.cra.lookout.application.port;

import ca.gc.cra.lookout.domain.record.SessionRecord;

/**
 * <strong>What:</strong> Subscriber receiving accepted session records.
 * <p><strong>Role:</strong> Outbound port implemented by the session aggregator and output adapters.</p>
 * <p><strong>Thread-safety:</strong> The event bus never invokes a listener concurrently with itself;
 * implementations need no locking for delivery, only for state they expose to other threads.</p>
 * <p><strong>Performance:</strong> Called inline on the reader thread that accepted the record; slow
 * listeners delay the whole stream.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SessionRecordListener {
  /**
   * Handles one record.
   *
   * @param record accepted record; never {@code null}
   */
  void onRecord(SessionRecord record);
}
