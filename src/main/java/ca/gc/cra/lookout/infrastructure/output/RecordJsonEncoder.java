package ca.gc.cra.lookout.infrastructure.output;

import ca.gc.cra.lookout.domain.record.AssistantRecord;
import ca.gc.cra.lookout.domain.record.ContentBlock;
import ca.gc.cra.lookout.domain.record.FileBackup;
import ca.gc.cra.lookout.domain.record.FileHistorySnapshotRecord;
import ca.gc.cra.lookout.domain.record.RecordHeader;
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
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Serializes typed session records to compact, single-line JSON.
 * <p><strong>Role:</strong> Shared by the NDJSON writer and the Kafka publisher.</p>
 * <p><strong>Format:</strong> A {@code schemaVersion}, the common header fields ({@code type},
 * {@code timestamp} as ISO-8601, {@code sessionId}, {@code uuid}, {@code parentUuid}, {@code agentId},
 * {@code subAgent}) followed by type-specific fields. Tool-use input is embedded as the original JSON
 * value.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; generators are created per call.</p>
 *
 * @since 0.1.0
 */
public final class RecordJsonEncoder {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory factory = new JsonFactory();

  /**
   * Encodes a record.
   *
   * @param record record to encode
   * @return JSON text without a trailing newline
   */
  public String encode(SessionRecord record) {
    Objects.requireNonNull(record, "record");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      writeHeader(gen, record.header());
      if (record instanceof AssistantRecord assistant) {
        writeAssistant(gen, assistant);
      } else if (record instanceof UserRecord user) {
        writeUser(gen, user);
      } else if (record instanceof SystemRecord system) {
        writeOptional(gen, "content", system.content());
        writeOptional(gen, "level", system.level());
        writeOptional(gen, "subtype", system.subtype());
      } else if (record instanceof SummaryRecord summary) {
        writeOptional(gen, "summary", summary.summary());
        writeOptional(gen, "leafUuid", summary.leafUuid());
      } else if (record instanceof FileHistorySnapshotRecord snapshot) {
        writeSnapshot(gen, snapshot);
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode " + record.type() + " record", ex);
    }
    return out.toString();
  }

  private static void writeHeader(JsonGenerator gen, RecordHeader header) throws IOException {
    gen.writeStringField("type", header.type().wireName());
    writeInstant(gen, "timestamp", header.timestamp());
    writeOptional(gen, "sessionId", header.sessionId());
    writeOptional(gen, "uuid", header.uuid());
    writeOptional(gen, "parentUuid", header.parentUuid());
    writeOptional(gen, "agentId", header.agentId());
    gen.writeBooleanField("subAgent", header.subAgent());
    writeOptional(gen, "cwd", header.cwd());
    writeOptional(gen, "version", header.version());
    writeOptional(gen, "gitBranch", header.gitBranch());
  }

  private static void writeAssistant(JsonGenerator gen, AssistantRecord record) throws IOException {
    writeOptional(gen, "messageId", record.messageId());
    writeOptional(gen, "requestId", record.requestId());
    writeOptional(gen, "model", record.model());
    writeOptional(gen, "stopReason", record.stopReason());
    if (record.contextTruncated() != null) {
      gen.writeBooleanField("contextTruncated", record.contextTruncated());
    }
    gen.writeArrayFieldStart("content");
    for (ContentBlock block : record.content()) {
      gen.writeStartObject();
      if (block instanceof ToolUseBlock use) {
        gen.writeStringField("type", "tool_use");
        gen.writeStringField("id", use.id());
        writeOptional(gen, "name", use.name());
        gen.writeFieldName("input");
        gen.writeRawValue(use.inputJson());
      } else if (block instanceof TextBlock text) {
        gen.writeStringField("type", "text");
        writeOptional(gen, "text", text.text());
      } else if (block instanceof ThinkingBlock thinking) {
        gen.writeStringField("type", "thinking");
        writeOptional(gen, "thinking", thinking.text());
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
    TokenUsage usage = record.usage();
    gen.writeObjectFieldStart("usage");
    gen.writeNumberField("inputTokens", usage.inputTokens());
    gen.writeNumberField("outputTokens", usage.outputTokens());
    gen.writeNumberField("cacheReadInputTokens", usage.cacheReadInputTokens());
    gen.writeNumberField("cacheCreationInputTokens", usage.cacheCreationInputTokens());
    gen.writeNumberField("webSearchRequests", usage.webSearchRequests());
    gen.writeNumberField("webFetchRequests", usage.webFetchRequests());
    writeOptional(gen, "serviceTier", usage.serviceTier());
    gen.writeEndObject();
  }

  private static void writeUser(JsonGenerator gen, UserRecord record) throws IOException {
    writeOptional(gen, "text", record.text());
    if (!record.toolResults().isEmpty()) {
      gen.writeArrayFieldStart("toolResults");
      for (ToolResultBlock result : record.toolResults()) {
        gen.writeStartObject();
        gen.writeStringField("toolUseId", result.toolUseId());
        gen.writeStringField("content", result.content());
        gen.writeBooleanField("isError", result.error());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (record.todos() != null) {
      gen.writeArrayFieldStart("todos");
      for (TodoItem todo : record.todos()) {
        gen.writeStartObject();
        gen.writeStringField("content", todo.content());
        gen.writeStringField("status", todo.status());
        writeOptional(gen, "activeForm", todo.activeForm());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    ToolExecutionMeta meta = record.toolExecution();
    if (meta != null) {
      gen.writeObjectFieldStart("toolExecution");
      gen.writeBooleanField("stdout", meta.hasStdout());
      gen.writeBooleanField("stderr", meta.hasStderr());
      gen.writeBooleanField("interrupted", meta.interrupted());
      gen.writeBooleanField("image", meta.image());
      gen.writeEndObject();
    }
  }

  private static void writeSnapshot(JsonGenerator gen, FileHistorySnapshotRecord record) throws IOException {
    writeOptional(gen, "messageId", record.messageId());
    writeInstant(gen, "snapshotTime", record.snapshotTime());
    gen.writeBooleanField("update", record.update());
    gen.writeArrayFieldStart("backups");
    for (FileBackup backup : record.backups()) {
      gen.writeStartObject();
      gen.writeStringField("path", backup.path());
      writeOptional(gen, "backupFileName", backup.backupFileName());
      gen.writeNumberField("version", backup.version());
      writeInstant(gen, "backupTime", backup.backupTime());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeOptional(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value);
    }
  }

  private static void writeInstant(JsonGenerator gen, String field, Instant value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value.toString());
    }
  }
}
