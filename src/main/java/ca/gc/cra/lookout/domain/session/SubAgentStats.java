package ca.gc.cra.lookout.domain.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Activity of one sub-agent within a session.
 *
 * @param agentId sub-agent id; never {@code null}
 * @param records records attributed to the sub-agent
 * @param toolCalls tool uses issued by the sub-agent
 * @param firstSeen earliest record timestamp, or {@code null}
 * @param lastSeen latest record timestamp, or {@code null}
 * @since 0.1.0
 */
public record SubAgentStats(String agentId, long records, long toolCalls, Instant firstSeen, Instant lastSeen) {
  public SubAgentStats {
    Objects.requireNonNull(agentId, "agentId");
  }

  /**
   * Starts tracking a sub-agent.
   *
   * @param agentId sub-agent id
   * @return stats with no activity
   */
  public static SubAgentStats first(String agentId) {
    return new SubAgentStats(agentId, 0, 0, null, null);
  }

  /**
   * Accounts for one more record.
   *
   * @param timestamp record instant; may be {@code null}
   * @param newToolCalls tool uses carried by the record
   * @return updated stats
   */
  public SubAgentStats record(Instant timestamp, int newToolCalls) {
    Instant first = firstSeen;
    Instant last = lastSeen;
    if (timestamp != null) {
      first = first == null || timestamp.isBefore(first) ? timestamp : first;
      last = last == null || timestamp.isAfter(last) ? timestamp : last;
    }
    return new SubAgentStats(agentId, records + 1, toolCalls + newToolCalls, first, last);
  }
}
