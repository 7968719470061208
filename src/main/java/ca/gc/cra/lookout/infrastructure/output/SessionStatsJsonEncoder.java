package ca.gc.cra.lookout.infrastructure.output;

import ca.gc.cra.lookout.domain.record.RecordType;
import ca.gc.cra.lookout.domain.session.LedgerEntry;
import ca.gc.cra.lookout.domain.session.SessionInfo;
import ca.gc.cra.lookout.domain.session.SessionStats;
import ca.gc.cra.lookout.domain.session.SubAgentStats;
import ca.gc.cra.lookout.domain.session.TokenTotals;
import ca.gc.cra.lookout.domain.session.ToolCorrelation;
import ca.gc.cra.lookout.domain.session.ToolExecutionTotals;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders {@link SessionStats} as a JSON report.
 *
 * <p>Durations are written in milliseconds; instants as ISO-8601 strings. Correlations are listed in call
 * order.</p>
 *
 * @since 0.1.0
 */
public final class SessionStatsJsonEncoder {
  private final JsonFactory factory = new JsonFactory();
  private final boolean pretty;

  /**
   * Creates an encoder.
   *
   * @param pretty {@code true} to indent the output
   */
  public SessionStatsJsonEncoder(boolean pretty) {
    this.pretty = pretty;
  }

  /**
   * Encodes a statistics snapshot.
   *
   * @param stats snapshot to encode
   * @return JSON document
   */
  public String encode(SessionStats stats) {
    Objects.requireNonNull(stats, "stats");
    StringWriter out = new StringWriter(1024);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      writeInfo(gen, stats.info());
      gen.writeNumberField("totalRecords", stats.totalRecords());
      gen.writeObjectFieldStart("recordsByType");
      for (RecordType type : RecordType.values()) {
        gen.writeNumberField(type.wireName(), stats.count(type));
      }
      gen.writeEndObject();

      gen.writeObjectFieldStart("tools");
      gen.writeNumberField("calls", stats.toolCalls());
      gen.writeNumberField("results", stats.toolResults());
      gen.writeNumberField("errors", stats.toolErrors());
      gen.writeNumberField("unmatchedResults", stats.unmatchedToolResults());
      gen.writeNumberField("pending", stats.pendingCorrelations().size());
      writeCounts(gen, "usage", stats.toolUsage());
      writeExecution(gen, stats.toolExecution());
      gen.writeEndObject();

      gen.writeObjectFieldStart("messages");
      gen.writeNumberField("textBlocks", stats.textBlocks());
      gen.writeNumberField("thinkingBlocks", stats.thinkingBlocks());
      gen.writeNumberField("rootMessages", stats.rootMessages());
      gen.writeNumberField("contextTruncations", stats.contextTruncations());
      gen.writeNumberField("distinctRequests", stats.distinctRequests());
      writeCounts(gen, "models", stats.modelUsage());
      writeCounts(gen, "stopReasons", stats.stopReasons());
      gen.writeEndObject();

      writeTokens(gen, stats.tokens(), stats.serviceTiers());
      writeCorrelations(gen, stats.correlations());

      gen.writeObjectFieldStart("todos");
      gen.writeNumberField("snapshots", stats.todoSnapshots());
      gen.writeNumberField("completed", stats.completedTodos());
      gen.writeNumberField("inProgress", stats.inProgressTodos());
      gen.writeNumberField("pending", stats.pendingTodos());
      gen.writeEndObject();

      gen.writeNumberField("fileBackups", stats.backups().size());
      gen.writeArrayFieldStart("modifiedFiles");
      for (String file : stats.modifiedFiles()) {
        gen.writeString(file);
      }
      gen.writeEndArray();

      writeLedger(gen, "summaries", stats.summaries());
      writeLedger(gen, "errors", stats.errors());
      gen.writeNumberField("systemMessages", stats.systemMessages().size());
      writeSubAgents(gen, stats.subAgents());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode session stats", ex);
    }
    return out.toString();
  }

  private static void writeInfo(JsonGenerator gen, SessionInfo info) throws IOException {
    gen.writeObjectFieldStart("session");
    writeOptional(gen, "sessionId", info.sessionId());
    writeOptional(gen, "cwd", info.cwd());
    writeOptional(gen, "version", info.version());
    writeOptional(gen, "gitBranch", info.gitBranch());
    writeOptional(gen, "slug", info.slug());
    writeInstant(gen, "startedAt", info.startedAt());
    writeInstant(gen, "lastActivityAt", info.lastActivityAt());
    gen.writeEndObject();
  }

  private static void writeTokens(JsonGenerator gen, TokenTotals tokens, Map<String, Long> tiers)
      throws IOException {
    gen.writeObjectFieldStart("tokens");
    gen.writeNumberField("input", tokens.inputTokens());
    gen.writeNumberField("output", tokens.outputTokens());
    gen.writeNumberField("cacheRead", tokens.cacheReadInputTokens());
    gen.writeNumberField("cacheCreation", tokens.cacheCreationInputTokens());
    gen.writeNumberField("total", tokens.totalTokens());
    gen.writeNumberField("cacheHitRate", tokens.cacheHitRate());
    gen.writeNumberField("webSearchRequests", tokens.webSearchRequests());
    gen.writeNumberField("webFetchRequests", tokens.webFetchRequests());
    writeCounts(gen, "serviceTiers", tiers);
    gen.writeEndObject();
  }

  private static void writeExecution(JsonGenerator gen, ToolExecutionTotals totals) throws IOException {
    gen.writeObjectFieldStart("execution");
    gen.writeNumberField("withStdout", totals.withStdout());
    gen.writeNumberField("withStderr", totals.withStderr());
    gen.writeNumberField("interrupted", totals.interrupted());
    gen.writeNumberField("images", totals.images());
    gen.writeEndObject();
  }

  private static void writeCorrelations(JsonGenerator gen, Map<String, ToolCorrelation> correlations)
      throws IOException {
    gen.writeArrayFieldStart("correlations");
    for (ToolCorrelation correlation : correlations.values()) {
      gen.writeStartObject();
      gen.writeStringField("toolUseId", correlation.toolUseId());
      writeOptional(gen, "tool", correlation.toolName());
      writeOptional(gen, "agentId", correlation.agentId());
      writeInstant(gen, "calledAt", correlation.callTimestamp());
      writeInstant(gen, "completedAt", correlation.resultTimestamp());
      gen.writeBooleanField("completed", correlation.completed());
      if (correlation.completed()) {
        gen.writeNumberField("durationMillis", correlation.duration().toMillis());
        gen.writeBooleanField("success", correlation.success());
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeLedger(JsonGenerator gen, String field, List<LedgerEntry> entries)
      throws IOException {
    gen.writeArrayFieldStart(field);
    for (LedgerEntry entry : entries) {
      gen.writeStartObject();
      writeInstant(gen, "timestamp", entry.timestamp());
      gen.writeStringField("source", entry.source());
      writeOptional(gen, "reference", entry.reference());
      gen.writeStringField("text", entry.text());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeSubAgents(JsonGenerator gen, Map<String, SubAgentStats> agents) throws IOException {
    gen.writeArrayFieldStart("subAgents");
    for (SubAgentStats agent : agents.values()) {
      gen.writeStartObject();
      gen.writeStringField("agentId", agent.agentId());
      gen.writeNumberField("records", agent.records());
      gen.writeNumberField("toolCalls", agent.toolCalls());
      writeInstant(gen, "firstSeen", agent.firstSeen());
      writeInstant(gen, "lastSeen", agent.lastSeen());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeCounts(JsonGenerator gen, String field, Map<String, Long> counts) throws IOException {
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
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
