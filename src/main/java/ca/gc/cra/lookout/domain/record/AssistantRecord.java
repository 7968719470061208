package ca.gc.cra.lookout.domain.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Assistant turn: ordered content blocks plus model and usage metadata.
 * <p><strong>Thread-safety:</strong> Immutable; the block list is copied on construction.</p>
 *
 * @param header common fields; type must be {@link RecordType#ASSISTANT}
 * @param messageId API message id, or {@code null}
 * @param requestId API request id, or {@code null}
 * @param model model identifier, or {@code null}
 * @param content ordered content blocks
 * @param usage token usage; {@link TokenUsage#EMPTY} when absent
 * @param stopReason stop reason, or {@code null} while the message streams
 * @param contextTruncated {@code Boolean.TRUE} when context management truncated the prompt;
 *     {@code null} when not reported
 * @since 0.1.0
 */
public record AssistantRecord(
    RecordHeader header,
    String messageId,
    String requestId,
    String model,
    List<ContentBlock> content,
    TokenUsage usage,
    String stopReason,
    Boolean contextTruncated) implements SessionRecord {

  public AssistantRecord {
    Objects.requireNonNull(header, "header");
    if (header.type() != RecordType.ASSISTANT) {
      throw new IllegalArgumentException("header type must be ASSISTANT");
    }
    content = content == null ? List.of() : List.copyOf(content);
    usage = usage == null ? TokenUsage.EMPTY : usage;
  }

  @Override
  public AssistantRecord asSubAgent(String fallbackAgentId) {
    return new AssistantRecord(
        header.asSubAgent(fallbackAgentId), messageId, requestId, model, content, usage, stopReason,
        contextTruncated);
  }

  /**
   * Returns the tool-use blocks in message order.
   *
   * @return tool uses; empty when the turn invoked no tools
   */
  public List<ToolUseBlock> toolUses() {
    List<ToolUseBlock> uses = new ArrayList<>();
    for (ContentBlock block : content) {
      if (block instanceof ToolUseBlock use) {
        uses.add(use);
      }
    }
    return uses;
  }
}
