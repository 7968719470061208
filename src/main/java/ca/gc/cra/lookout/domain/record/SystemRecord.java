package ca.gc.cra.lookout.domain.record;

import java.util.Objects;

/**
 * Notice written by the agent runtime.
 *
 * @param header common fields; type must be {@link RecordType#SYSTEM}
 * @param content notice text; empty when absent
 * @param level severity such as {@code info}, {@code warning} or {@code error}; may be {@code null}
 * @param subtype runtime-specific subtype, or {@code null}
 * @since 0.1.0
 */
public record SystemRecord(RecordHeader header, String content, String level, String subtype)
    implements SessionRecord {

  public SystemRecord {
    Objects.requireNonNull(header, "header");
    if (header.type() != RecordType.SYSTEM) {
      throw new IllegalArgumentException("header type must be SYSTEM");
    }
    content = content == null ? "" : content;
  }

  @Override
  public SystemRecord asSubAgent(String fallbackAgentId) {
    return new SystemRecord(header.asSubAgent(fallbackAgentId), content, level, subtype);
  }

  public boolean isError() {
    return level != null && level.trim().equalsIgnoreCase("error");
  }
}
