package ca.gc.cra.lookout.domain.record;

import java.util.Objects;

/**
 * Result of a tool invocation, carried by a user record.
 *
 * @param toolUseId id of the tool use this result answers; never {@code null}
 * @param content result text, or the raw JSON of structured content; empty when absent
 * @param error {@code true} when the tool reported a failure
 * @since 0.1.0
 */
public record ToolResultBlock(String toolUseId, String content, boolean error) {
  public ToolResultBlock {
    Objects.requireNonNull(toolUseId, "toolUseId");
    content = content == null ? "" : content;
  }

  /**
   * Returns whether the tool succeeded.
   *
   * @return negation of {@link #error()}
   */
  public boolean success() {
    return !error;
  }
}
