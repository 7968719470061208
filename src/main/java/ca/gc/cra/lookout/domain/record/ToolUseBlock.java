package ca.gc.cra.lookout.domain.record;

import java.util.Objects;

/**
 * Tool invocation requested by the assistant.
 *
 * @param id tool-use id later echoed by the matching tool result; never {@code null}
 * @param name tool name, or {@code null} when absent
 * @param inputJson tool input kept as raw JSON text; {@code "null"} when absent
 * @since 0.1.0
 */
public record ToolUseBlock(String id, String name, String inputJson) implements ContentBlock {
  public ToolUseBlock {
    Objects.requireNonNull(id, "id");
    inputJson = inputJson == null ? "null" : inputJson;
  }
}
