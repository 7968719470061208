package ca.gc.cra.lookout.domain.record;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Tag identifying the variant of a {@link SessionRecord}.
 * <p><strong>Why:</strong> Session logs carry a top-level {@code type} field; only the values listed here
 * produce records.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum RecordType {
  /** Model turn with content blocks and token usage. */
  ASSISTANT("assistant"),
  /** Prompt text or tool results fed back to the model. */
  USER("user"),
  /** Informational or error notice written by the agent runtime. */
  SYSTEM("system"),
  /** Conversation summary produced on compaction. */
  SUMMARY("summary"),
  /** Snapshot of file backups taken before edits. */
  FILE_HISTORY_SNAPSHOT("file-history-snapshot");

  private final String wireName;

  RecordType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the value used for this type in the {@code type} field of a log line.
   *
   * @return wire name such as {@code assistant}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name to a record type.
   *
   * @param value raw {@code type} field; may be {@code null}
   * @return matching type, or empty for unknown or missing values
   */
  public static Optional<RecordType> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (RecordType type : values()) {
      if (type.wireName.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
