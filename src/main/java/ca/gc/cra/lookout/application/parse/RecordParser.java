package ca.gc.cra.lookout.application.parse;

import ca.gc.cra.lookout.domain.record.AssistantRecord;
import ca.gc.cra.lookout.domain.record.ContentBlock;
import ca.gc.cra.lookout.domain.record.FileBackup;
import ca.gc.cra.lookout.domain.record.FileHistorySnapshotRecord;
import ca.gc.cra.lookout.domain.record.RecordHeader;
import ca.gc.cra.lookout.domain.record.RecordType;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.domain.record.SummaryRecord;
import ca.gc.cra.lookout.domain.record.SystemRecord;
import ca.gc.cra.lookout.domain.record.TextBlock;
import ca.gc.cra.lookout.domain.record.ThinkingBlock;
import ca.gc.cra.lookout.domain.record.TodoItem;
import ca.gc.cra.lookout.domain.record.TokenUsage;
import ca.gc.cra.lookout.domain.record.ToolExecutionMeta;
import ca.gc.cra.lookout.domain.record.ToolResultBlock;
import ca.gc.cra.lookout.domain.record.ToolUseBlock;
import ca.gc.cra.lookout.domain.record.UserRecord;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Converts one JSONL session log line into the {@link SessionRecord} variant named by
 * its {@code type} field.
 * <p><strong>Role:</strong> Application service invoked by the file tailer for every complete line.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Dispatch on {@code type}; unknown or missing types yield no record.</li>
 *   <li>Extract assistant content blocks in order, keeping tool inputs as raw JSON.</li>
 *   <li>Extract user tool results, todo snapshots and tool execution metadata.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonSupport}; one instance may
 * be shared by all reader threads.</p>
 *
 * @since 0.1.0
 */
public final class RecordParser {
  private final JsonSupport json;

  public RecordParser() {
    this(new JsonSupport());
  }

  public RecordParser(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a single line.
   *
   * @param line complete line without terminator; never {@code null}
   * @return typed record, or empty when the type is unknown or absent
   * @throws IllegalArgumentException when the line is not a JSON object
   */
  public Optional<SessionRecord> parse(String line) {
    Objects.requireNonNull(line, "line");
    Object root = json.parse(line);
    if (!(root instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("Session record must be a JSON object");
    }
    Map<?, ?> obj = (Map<?, ?>) root;
    Optional<RecordType> type = RecordType.fromWire(text(obj, "type"));
    if (type.isEmpty()) {
      return Optional.empty();
    }
    SessionRecord record = switch (type.get()) {
      case ASSISTANT -> parseAssistant(obj);
      case USER -> parseUser(obj);
      case SYSTEM -> parseSystem(obj);
      case SUMMARY -> parseSummary(obj);
      case FILE_HISTORY_SNAPSHOT -> parseSnapshot(obj);
    };
    return Optional.of(record);
  }

  private AssistantRecord parseAssistant(Map<?, ?> obj) {
    RecordHeader header = header(RecordType.ASSISTANT, obj, timestamp(obj.get("timestamp")));
    Map<?, ?> message = object(obj.get("message"));
    List<ContentBlock> blocks = new ArrayList<>();
    for (Object item : list(message.get("content"))) {
      Map<?, ?> block = object(item);
      String blockType = text(block, "type");
      if ("tool_use".equals(blockType)) {
        String id = text(block, "id");
        if (id != null) {
          blocks.add(new ToolUseBlock(id, text(block, "name"), json.write(block.get("input"))));
        }
      } else if ("text".equals(blockType)) {
        blocks.add(new TextBlock(text(block, "text")));
      } else if ("thinking".equals(blockType)) {
        blocks.add(new ThinkingBlock(text(block, "thinking")));
      }
    }
    Map<?, ?> contextManagement = object(message.get("context_management"));
    Boolean truncated = contextManagement.get("truncated") instanceof Boolean flag ? flag : null;
    return new AssistantRecord(
        header,
        text(message, "id"),
        text(obj, "requestId"),
        text(message, "model"),
        blocks,
        usage(object(message.get("usage"))),
        text(message, "stop_reason"),
        truncated);
  }

  private UserRecord parseUser(Map<?, ?> obj) {
    RecordHeader header = header(RecordType.USER, obj, timestamp(obj.get("timestamp")));
    Map<?, ?> message = object(obj.get("message"));
    Object content = message.get("content");
    String text = null;
    List<ToolResultBlock> results = new ArrayList<>();
    if (content instanceof String raw) {
      text = raw;
    } else {
      StringJoiner joined = new StringJoiner("\n");
      boolean sawText = false;
      for (Object item : list(content)) {
        Map<?, ?> block = object(item);
        String blockType = text(block, "type");
        if ("tool_result".equals(blockType)) {
          String toolUseId = text(block, "tool_use_id");
          if (toolUseId != null) {
            results.add(new ToolResultBlock(
                toolUseId, resultContent(block.get("content")), Boolean.TRUE.equals(block.get("is_error"))));
          }
        } else if ("text".equals(blockType)) {
          joined.add(Objects.requireNonNullElse(text(block, "text"), ""));
          sawText = true;
        }
      }
      if (sawText) {
        text = joined.toString();
      }
    }
    return new UserRecord(header, text, results, todos(obj.get("todos")), toolExecution(obj.get("toolUseResult")));
  }

  private SystemRecord parseSystem(Map<?, ?> obj) {
    RecordHeader header = header(RecordType.SYSTEM, obj, timestamp(obj.get("timestamp")));
    return new SystemRecord(header, text(obj, "content"), text(obj, "level"), text(obj, "subtype"));
  }

  private SummaryRecord parseSummary(Map<?, ?> obj) {
    RecordHeader header = header(RecordType.SUMMARY, obj, timestamp(obj.get("timestamp")));
    return new SummaryRecord(header, text(obj, "summary"), text(obj, "leafUuid"));
  }

  private FileHistorySnapshotRecord parseSnapshot(Map<?, ?> obj) {
    Map<?, ?> snapshot = object(obj.get("snapshot"));
    Instant snapshotTime = timestamp(snapshot.get("timestamp"));
    Instant recordTime = timestamp(obj.get("timestamp"));
    RecordHeader header = header(
        RecordType.FILE_HISTORY_SNAPSHOT, obj, recordTime != null ? recordTime : snapshotTime);
    List<FileBackup> backups = new ArrayList<>();
    for (Map.Entry<?, ?> entry : object(snapshot.get("trackedFileBackups")).entrySet()) {
      if (entry.getKey() == null) {
        continue;
      }
      Map<?, ?> backup = object(entry.getValue());
      backups.add(new FileBackup(
          entry.getKey().toString(),
          text(backup, "backupFileName"),
          (int) number(backup.get("version")),
          timestamp(backup.get("backupTime"))));
    }
    String messageId = text(obj, "messageId");
    return new FileHistorySnapshotRecord(
        header,
        messageId != null ? messageId : text(snapshot, "messageId"),
        snapshotTime,
        Boolean.TRUE.equals(obj.get("isSnapshotUpdate")),
        backups);
  }

  private static RecordHeader header(RecordType type, Map<?, ?> obj, Instant timestamp) {
    String agentId = text(obj, "agentId");
    boolean subAgent = Boolean.TRUE.equals(obj.get("isSidechain")) || (agentId != null && !agentId.isBlank());
    return new RecordHeader(
        type,
        timestamp,
        text(obj, "sessionId"),
        text(obj, "uuid"),
        text(obj, "parentUuid"),
        agentId,
        subAgent,
        text(obj, "cwd"),
        text(obj, "version"),
        text(obj, "gitBranch"),
        text(obj, "slug"));
  }

  private static TokenUsage usage(Map<?, ?> usage) {
    if (usage.isEmpty()) {
      return TokenUsage.EMPTY;
    }
    Map<?, ?> serverTools = object(usage.get("server_tool_use"));
    return new TokenUsage(
        number(usage.get("input_tokens")),
        number(usage.get("output_tokens")),
        number(usage.get("cache_read_input_tokens")),
        number(usage.get("cache_creation_input_tokens")),
        number(serverTools.get("web_search_requests")),
        number(serverTools.get("web_fetch_requests")),
        text(usage, "service_tier"));
  }

  private String resultContent(Object content) {
    if (content == null) {
      return "";
    }
    if (content instanceof String raw) {
      return raw;
    }
    return json.write(content);
  }

  private static List<TodoItem> todos(Object value) {
    if (!(value instanceof List<?> items)) {
      return null;
    }
    List<TodoItem> todos = new ArrayList<>(items.size());
    for (Object item : items) {
      Map<?, ?> todo = object(item);
      if (todo.isEmpty()) {
        continue;
      }
      todos.add(new TodoItem(text(todo, "content"), text(todo, "status"), text(todo, "activeForm")));
    }
    return todos;
  }

  private static ToolExecutionMeta toolExecution(Object value) {
    if (!(value instanceof Map<?, ?> meta)) {
      return null;
    }
    return new ToolExecutionMeta(
        hasText(meta.get("stdout")),
        hasText(meta.get("stderr")),
        Boolean.TRUE.equals(meta.get("interrupted")),
        Boolean.TRUE.equals(meta.get("isImage")));
  }

  static Instant timestamp(Object value) {
    if (!(value instanceof String raw) || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      try {
        return OffsetDateTime.parse(raw.trim()).toInstant();
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }

  private static boolean hasText(Object value) {
    return value instanceof String raw && !raw.isEmpty();
  }

  private static String text(Map<?, ?> obj, String key) {
    Object value = obj.get(key);
    return value instanceof String raw ? raw : null;
  }

  private static long number(Object value) {
    if (value instanceof Number n) {
      return Math.max(0L, n.longValue());
    }
    return 0L;
  }

  private static Map<?, ?> object(Object value) {
    return value instanceof Map<?, ?> map ? map : new LinkedHashMap<>();
  }

  private static List<?> list(Object value) {
    return value instanceof List<?> items ? items : List.of();
  }
}
