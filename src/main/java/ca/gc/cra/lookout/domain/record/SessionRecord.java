package ca.gc.cra.lookout.domain.record;

import java.time.Instant;

/**
 * <strong>What:</strong> One typed line of an agent session log.
 * <p><strong>Why:</strong> Subscribers switch on the concrete variant instead of probing loosely structured
 * JSON.</p>
 * <p><strong>Role:</strong> Domain value produced by the record parser and delivered by the event bus.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface SessionRecord
    permits AssistantRecord, UserRecord, SystemRecord, SummaryRecord, FileHistorySnapshotRecord {

  /**
   * Returns the fields shared by all variants.
   *
   * @return header; never {@code null}
   */
  RecordHeader header();

  /**
   * Returns a copy of this record flagged as produced by a sub-agent.
   *
   * @param fallbackAgentId agent id applied when the record does not carry one
   * @return sub-agent copy
   */
  SessionRecord asSubAgent(String fallbackAgentId);

  default RecordType type() {
    return header().type();
  }

  default Instant timestamp() {
    return header().timestamp();
  }

  default String uuid() {
    return header().uuid();
  }

  default String sessionId() {
    return header().sessionId();
  }

  default boolean subAgent() {
    return header().subAgent();
  }
}
