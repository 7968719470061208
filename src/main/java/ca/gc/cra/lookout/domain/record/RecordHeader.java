package ca.gc.cra.lookout.domain.record;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Fields shared by every session record variant.
 * <p><strong>Role:</strong> Carries identity ({@code uuid}), thread linkage ({@code parentUuid}) and origin
 * (session, sub-agent) for a parsed log line.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param type record variant; never {@code null}
 * @param timestamp instant the agent wrote the record, or {@code null} when absent or unparseable
 * @param sessionId session identifier reported by the line, or {@code null}
 * @param uuid unique record id, or {@code null} (summaries and snapshots carry none)
 * @param parentUuid id of the preceding record in the thread, or {@code null} for roots
 * @param agentId sub-agent id; {@code null} for records of the primary agent
 * @param subAgent {@code true} when the record came from a sub-agent
 * @param cwd working directory of the agent, or {@code null}
 * @param version agent CLI version, or {@code null}
 * @param gitBranch git branch active in {@code cwd}, or {@code null}
 * @param slug human-readable session slug, or {@code null}
 * @since 0.1.0
 */
public record RecordHeader(
    RecordType type,
    Instant timestamp,
    String sessionId,
    String uuid,
    String parentUuid,
    String agentId,
    boolean subAgent,
    String cwd,
    String version,
    String gitBranch,
    String slug) {

  public RecordHeader {
    Objects.requireNonNull(type, "type");
  }

  /**
   * Creates a header carrying only a type and timestamp.
   *
   * @param type record variant
   * @param timestamp record instant; may be {@code null}
   * @return minimal header
   */
  public static RecordHeader of(RecordType type, Instant timestamp) {
    return new RecordHeader(type, timestamp, null, null, null, null, false, null, null, null, null);
  }

  /**
   * Indicates whether the record carries a non-empty unique id.
   *
   * @return {@code true} when {@link #uuid()} is present
   */
  public boolean hasUuid() {
    return uuid != null && !uuid.isBlank();
  }

  /**
   * Marks the header as originating from a sub-agent.
   *
   * @param fallbackAgentId agent id used when the line did not carry one; may be {@code null}
   * @return header flagged as sub-agent
   */
  public RecordHeader asSubAgent(String fallbackAgentId) {
    String effectiveAgent = agentId != null && !agentId.isBlank() ? agentId : fallbackAgentId;
    return new RecordHeader(
        type, timestamp, sessionId, uuid, parentUuid, effectiveAgent, true, cwd, version, gitBranch, slug);
  }
}
