package ca.gc.cra.lookout.domain.record;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> User turn carrying either prompt text or tool results.
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied on construction.</p>
 *
 * @param header common fields; type must be {@link RecordType#USER}
 * @param text plain prompt text, or {@code null} when the turn carries tool results
 * @param toolResults ordered tool results; empty for plain prompts
 * @param todos todo-list snapshot, or {@code null} when the line carried none
 * @param toolExecution execution metadata of the tool result, or {@code null}
 * @since 0.1.0
 */
public record UserRecord(
    RecordHeader header,
    String text,
    List<ToolResultBlock> toolResults,
    List<TodoItem> todos,
    ToolExecutionMeta toolExecution) implements SessionRecord {

  public UserRecord {
    Objects.requireNonNull(header, "header");
    if (header.type() != RecordType.USER) {
      throw new IllegalArgumentException("header type must be USER");
    }
    toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    todos = todos == null ? null : List.copyOf(todos);
  }

  @Override
  public UserRecord asSubAgent(String fallbackAgentId) {
    return new UserRecord(header.asSubAgent(fallbackAgentId), text, toolResults, todos, toolExecution);
  }

  /**
   * Returns the todo snapshot when the line carried one.
   *
   * @return todo snapshot; an empty list is a valid snapshot meaning "no todos"
   */
  public Optional<List<TodoItem>> todoSnapshot() {
    return Optional.ofNullable(todos);
  }

  public Optional<ToolExecutionMeta> toolExecutionMeta() {
    return Optional.ofNullable(toolExecution);
  }
}
