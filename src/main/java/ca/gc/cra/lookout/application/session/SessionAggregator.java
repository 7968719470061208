package ca.gc.cra.lookout.application.session;

import ca.gc.cra.lookout.application.port.SessionRecordListener;
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
import ca.gc.cra.lookout.domain.record.ToolResultBlock;
import ca.gc.cra.lookout.domain.record.ToolUseBlock;
import ca.gc.cra.lookout.domain.record.UserRecord;
import ca.gc.cra.lookout.domain.session.LedgerEntry;
import ca.gc.cra.lookout.domain.session.SessionInfo;
import ca.gc.cra.lookout.domain.session.SessionStats;
import ca.gc.cra.lookout.domain.session.SubAgentStats;
import ca.gc.cra.lookout.domain.session.TokenTotals;
import ca.gc.cra.lookout.domain.session.ToolCorrelation;
import ca.gc.cra.lookout.domain.session.ToolExecutionTotals;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds emitted session records into running {@link SessionStats}.
 * <p><strong>Why:</strong> Consumers want counters, token sums and tool call/result correlation without
 * replaying the log themselves.</p>
 * <p><strong>Role:</strong> Application-layer subscriber of the record bus.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count records by type, tool calls, tool results and tool errors.</li>
 *   <li>Sum token usage and tally per-tool, per-model, stop-reason and service-tier usage.</li>
 *   <li>Pair each tool result with the first tool use carrying the same id; results without a call are
 *   counted as unmatched.</li>
 *   <li>Keep the latest todo list, file backups, summaries, system messages, an error ledger and per
 *   sub-agent activity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods synchronize on the instance; {@link #snapshot()} returns an
 * immutable copy.</p>
 *
 * @since 0.1.0
 */
public final class SessionAggregator implements SessionRecordListener {
  private static final Logger log = LoggerFactory.getLogger(SessionAggregator.class);
  private static final String UNKNOWN_AGENT = "unknown";
  private static final String UNKNOWN_TOOL = "unknown";

  private final Map<RecordType, Long> recordsByType = new EnumMap<>(RecordType.class);
  private final Map<String, Long> toolUsage = new LinkedHashMap<>();
  private final Map<String, Long> modelUsage = new LinkedHashMap<>();
  private final Map<String, Long> stopReasons = new LinkedHashMap<>();
  private final Map<String, Long> serviceTiers = new LinkedHashMap<>();
  private final Map<String, ToolCorrelation> correlations = new LinkedHashMap<>();
  private final Map<String, SubAgentStats> subAgents = new LinkedHashMap<>();
  private final Set<String> requestIds = new HashSet<>();
  private final List<FileBackup> backups = new ArrayList<>();
  private final Set<String> modifiedFiles = new LinkedHashSet<>();
  private final List<LedgerEntry> summaries = new ArrayList<>();
  private final List<LedgerEntry> systemMessages = new ArrayList<>();
  private final List<LedgerEntry> errors = new ArrayList<>();

  private SessionInfo info = SessionInfo.EMPTY;
  private long totalRecords;
  private long toolCalls;
  private long toolResults;
  private long toolErrors;
  private long unmatchedToolResults;
  private long textBlocks;
  private long thinkingBlocks;
  private long rootMessages;
  private long contextTruncations;
  private long todoSnapshots;
  private TokenTotals tokens = TokenTotals.ZERO;
  private ToolExecutionTotals toolExecution = ToolExecutionTotals.ZERO;
  private List<TodoItem> latestTodos = List.of();

  @Override
  public synchronized void onRecord(SessionRecord record) {
    if (record == null) {
      return;
    }
    totalRecords++;
    recordsByType.merge(record.type(), 1L, Long::sum);
    updateInfo(record.header());

    int newToolCalls = 0;
    if (record instanceof AssistantRecord assistant) {
      newToolCalls = onAssistant(assistant);
    } else if (record instanceof UserRecord user) {
      onUser(user);
    } else if (record instanceof SystemRecord system) {
      onSystem(system);
    } else if (record instanceof SummaryRecord summary) {
      summaries.add(new LedgerEntry(summary.timestamp(), "summary", summary.leafUuid(), summary.summary()));
    } else if (record instanceof FileHistorySnapshotRecord snapshot) {
      onSnapshot(snapshot);
    }

    if (record.subAgent()) {
      String agentId = blankToNull(record.header().agentId());
      String key = agentId == null ? UNKNOWN_AGENT : agentId;
      SubAgentStats current = subAgents.getOrDefault(key, SubAgentStats.first(key));
      subAgents.put(key, current.record(record.timestamp(), newToolCalls));
    }
  }

  /**
   * Returns an immutable view of the statistics accumulated so far.
   *
   * @return stats snapshot
   */
  public synchronized SessionStats snapshot() {
    return new SessionStats(
        info,
        totalRecords,
        recordsByType,
        toolCalls,
        toolResults,
        toolErrors,
        unmatchedToolResults,
        textBlocks,
        thinkingBlocks,
        rootMessages,
        contextTruncations,
        requestIds.size(),
        tokens,
        toolUsage,
        modelUsage,
        stopReasons,
        serviceTiers,
        toolExecution,
        correlations,
        backups,
        modifiedFiles,
        latestTodos,
        todoSnapshots,
        summaries,
        systemMessages,
        errors,
        subAgents);
  }

  /** Discards all accumulated state. */
  public synchronized void reset() {
    recordsByType.clear();
    toolUsage.clear();
    modelUsage.clear();
    stopReasons.clear();
    serviceTiers.clear();
    correlations.clear();
    subAgents.clear();
    requestIds.clear();
    backups.clear();
    modifiedFiles.clear();
    summaries.clear();
    systemMessages.clear();
    errors.clear();
    info = SessionInfo.EMPTY;
    totalRecords = 0;
    toolCalls = 0;
    toolResults = 0;
    toolErrors = 0;
    unmatchedToolResults = 0;
    textBlocks = 0;
    thinkingBlocks = 0;
    rootMessages = 0;
    contextTruncations = 0;
    todoSnapshots = 0;
    tokens = TokenTotals.ZERO;
    toolExecution = ToolExecutionTotals.ZERO;
    latestTodos = List.of();
  }

  private int onAssistant(AssistantRecord record) {
    int calls = 0;
    for (ContentBlock block : record.content()) {
      if (block instanceof ToolUseBlock use) {
        calls++;
        toolCalls++;
        toolUsage.merge(use.name() == null ? UNKNOWN_TOOL : use.name(), 1L, Long::sum);
        ToolCorrelation previous = correlations.putIfAbsent(
            use.id(), ToolCorrelation.pending(use.id(), use.name(), record.header().agentId(), record.timestamp()));
        if (previous != null) {
          log.debug("Tool use id {} seen again; keeping the first call", use.id());
        }
      } else if (block instanceof TextBlock) {
        textBlocks++;
      } else if (block instanceof ThinkingBlock) {
        thinkingBlocks++;
      }
    }
    tokens = tokens.plus(record.usage());
    if (record.usage().serviceTier() != null) {
      serviceTiers.merge(record.usage().serviceTier(), 1L, Long::sum);
    }
    if (blankToNull(record.model()) != null) {
      modelUsage.merge(record.model(), 1L, Long::sum);
    }
    if (blankToNull(record.stopReason()) != null) {
      stopReasons.merge(record.stopReason(), 1L, Long::sum);
    }
    if (blankToNull(record.requestId()) != null) {
      requestIds.add(record.requestId());
    }
    if (Boolean.TRUE.equals(record.contextTruncated())) {
      contextTruncations++;
    }
    if (blankToNull(record.header().parentUuid()) == null) {
      rootMessages++;
    }
    return calls;
  }

  private void onUser(UserRecord record) {
    for (ToolResultBlock result : record.toolResults()) {
      toolResults++;
      if (result.error()) {
        toolErrors++;
        errors.add(new LedgerEntry(record.timestamp(), "tool_result", result.toolUseId(), result.content()));
      }
      ToolCorrelation call = correlations.get(result.toolUseId());
      if (call == null) {
        unmatchedToolResults++;
        log.debug("Tool result {} has no matching tool use", result.toolUseId());
      } else if (!call.completed()) {
        correlations.put(result.toolUseId(), call.complete(record.timestamp(), result.success()));
      }
    }
    record.todoSnapshot().ifPresent(todos -> {
      todoSnapshots++;
      latestTodos = todos;
    });
    record.toolExecutionMeta().ifPresent(meta -> toolExecution = toolExecution.plus(meta));
    if (record.toolResults().isEmpty() && blankToNull(record.header().parentUuid()) == null) {
      rootMessages++;
    }
  }

  private void onSystem(SystemRecord record) {
    LedgerEntry entry = new LedgerEntry(record.timestamp(), "system", record.subtype(), record.content());
    systemMessages.add(entry);
    if (record.isError()) {
      errors.add(entry);
    }
  }

  private void onSnapshot(FileHistorySnapshotRecord record) {
    for (FileBackup backup : record.backups()) {
      backups.add(backup);
      modifiedFiles.add(backup.path());
    }
  }

  private void updateInfo(RecordHeader header) {
    Instant ts = header.timestamp();
    Instant started = info.startedAt();
    Instant last = info.lastActivityAt();
    if (ts != null) {
      started = started == null || ts.isBefore(started) ? ts : started;
      last = last == null || ts.isAfter(last) ? ts : last;
    }
    String sessionId = info.sessionId();
    if (sessionId == null && !header.subAgent()) {
      sessionId = blankToNull(header.sessionId());
    }
    info = new SessionInfo(
        sessionId,
        firstNonBlank(info.cwd(), header.cwd()),
        firstNonBlank(header.version(), info.version()),
        firstNonBlank(header.gitBranch(), info.gitBranch()),
        firstNonBlank(header.slug(), info.slug()),
        started,
        last);
  }

  private static String firstNonBlank(String preferred, String fallback) {
    String value = blankToNull(preferred);
    return value != null ? value : blankToNull(fallback);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
