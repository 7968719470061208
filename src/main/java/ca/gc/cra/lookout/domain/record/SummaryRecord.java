package ca.gc.cra.lookout.domain.record;

import java.util.Objects;

/**
 * Conversation summary written when the agent compacts its context.
 *
 * @param header common fields; type must be {@link RecordType#SUMMARY}
 * @param summary summary text; empty when absent
 * @param leafUuid uuid of the last record covered by the summary, or {@code null}
 * @since 0.1.0
 */
public record SummaryRecord(RecordHeader header, String summary, String leafUuid) implements SessionRecord {
  public SummaryRecord {
    Objects.requireNonNull(header, "header");
    if (header.type() != RecordType.SUMMARY) {
      throw new IllegalArgumentException("header type must be SUMMARY");
    }
    summary = summary == null ? "" : summary;
  }

  @Override
  public SummaryRecord asSubAgent(String fallbackAgentId) {
    return new SummaryRecord(header.asSubAgent(fallbackAgentId), summary, leafUuid);
  }
}
