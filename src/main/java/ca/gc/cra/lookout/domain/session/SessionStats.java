package ca.gc.cra.lookout.domain.session;

import ca.gc.cra.lookout.domain.record.FileBackup;
import ca.gc.cra.lookout.domain.record.RecordType;
import ca.gc.cra.lookout.domain.record.TodoItem;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable snapshot of cumulative session statistics.
 * <p><strong>Why:</strong> Lets callers read aggregator state from any thread without sharing its mutable
 * maps.</p>
 * <p><strong>Role:</strong> Output value of the session aggregator.</p>
 * <p><strong>Thread-safety:</strong> Immutable; collections are copied on construction and iteration order is
 * preserved.</p>
 *
 * @param info descriptive session attributes
 * @param totalRecords records folded into the snapshot
 * @param recordsByType record count per type
 * @param toolCalls tool-use blocks seen
 * @param toolResults tool-result blocks seen
 * @param toolErrors tool results flagged as errors
 * @param unmatchedToolResults tool results with no prior tool use
 * @param textBlocks assistant text blocks seen
 * @param thinkingBlocks assistant thinking blocks seen
 * @param rootMessages user and assistant records without a parent id
 * @param contextTruncations assistant messages whose context was truncated
 * @param distinctRequests distinct API request ids
 * @param tokens cumulative token usage
 * @param toolUsage invocation count per tool name
 * @param modelUsage assistant record count per model
 * @param stopReasons assistant record count per stop reason
 * @param serviceTiers assistant record count per service tier
 * @param toolExecution tool execution metadata counts
 * @param correlations correlation per tool-use id in first-call order
 * @param backups file backup ledger in arrival order
 * @param modifiedFiles paths that appeared in any backup
 * @param latestTodos most recent todo snapshot
 * @param todoSnapshots number of todo snapshots seen
 * @param summaries summary ledger
 * @param systemMessages system notice ledger
 * @param errors error ledger
 * @param subAgents activity per sub-agent id
 * @since 0.1.0
 */
public record SessionStats(
    SessionInfo info,
    long totalRecords,
    Map<RecordType, Long> recordsByType,
    long toolCalls,
    long toolResults,
    long toolErrors,
    long unmatchedToolResults,
    long textBlocks,
    long thinkingBlocks,
    long rootMessages,
    long contextTruncations,
    long distinctRequests,
    TokenTotals tokens,
    Map<String, Long> toolUsage,
    Map<String, Long> modelUsage,
    Map<String, Long> stopReasons,
    Map<String, Long> serviceTiers,
    ToolExecutionTotals toolExecution,
    Map<String, ToolCorrelation> correlations,
    List<FileBackup> backups,
    Set<String> modifiedFiles,
    List<TodoItem> latestTodos,
    long todoSnapshots,
    List<LedgerEntry> summaries,
    List<LedgerEntry> systemMessages,
    List<LedgerEntry> errors,
    Map<String, SubAgentStats> subAgents) {

  public SessionStats {
    info = Objects.requireNonNullElse(info, SessionInfo.EMPTY);
    recordsByType = copy(recordsByType);
    tokens = Objects.requireNonNullElse(tokens, TokenTotals.ZERO);
    toolUsage = copy(toolUsage);
    modelUsage = copy(modelUsage);
    stopReasons = copy(stopReasons);
    serviceTiers = copy(serviceTiers);
    toolExecution = Objects.requireNonNullElse(toolExecution, ToolExecutionTotals.ZERO);
    correlations = copy(correlations);
    backups = backups == null ? List.of() : List.copyOf(backups);
    modifiedFiles = modifiedFiles == null
        ? Set.of()
        : Collections.unmodifiableSet(new LinkedHashSet<>(modifiedFiles));
    latestTodos = latestTodos == null ? List.of() : List.copyOf(latestTodos);
    summaries = summaries == null ? List.of() : List.copyOf(summaries);
    systemMessages = systemMessages == null ? List.of() : List.copyOf(systemMessages);
    errors = errors == null ? List.of() : List.copyOf(errors);
    subAgents = copy(subAgents);
  }

  /**
   * Returns the number of records of the given type.
   *
   * @param type record type
   * @return count, zero when none were seen
   */
  public long count(RecordType type) {
    return recordsByType.getOrDefault(type, 0L);
  }

  /**
   * Returns the correlations still waiting for a result.
   *
   * @return pending correlations in call order
   */
  public List<ToolCorrelation> pendingCorrelations() {
    return correlations.values().stream().filter(c -> !c.completed()).toList();
  }

  /**
   * Returns the correlations that received a result.
   *
   * @return completed correlations in call order
   */
  public List<ToolCorrelation> completedCorrelations() {
    return correlations.values().stream().filter(ToolCorrelation::completed).toList();
  }

  public long completedTodos() {
    return latestTodos.stream().filter(TodoItem::completed).count();
  }

  public long inProgressTodos() {
    return latestTodos.stream().filter(TodoItem::inProgress).count();
  }

  public long pendingTodos() {
    return latestTodos.stream().filter(TodoItem::pending).count();
  }

  private static <K, V> Map<K, V> copy(Map<K, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
