package ca.gc.cra.lookout.infrastructure.events;

import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.domain.record.AssistantRecord;
import ca.gc.cra.lookout.domain.record.ContentBlock;
import ca.gc.cra.lookout.domain.record.FileHistorySnapshotRecord;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.domain.record.SummaryRecord;
import ca.gc.cra.lookout.domain.record.SystemRecord;
import ca.gc.cra.lookout.domain.record.TextBlock;
import ca.gc.cra.lookout.domain.record.ToolResultBlock;
import ca.gc.cra.lookout.domain.record.ToolUseBlock;
import ca.gc.cra.lookout.domain.record.UserRecord;
import ca.gc.cra.lookout.logging.Logs;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a one-line summary of each record to the log and counts records per type.
 *
 * <p>Summaries are logged at DEBUG; counters are named {@code <prefix>.<type>}.</p>
 *
 * @since 0.1.0
 */
public final class LoggingRecordListener implements SessionRecordListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingRecordListener.class);
  private static final int PREVIEW_BYTES = 120;

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a listener.
   *
   * @param metrics metrics adapter; {@code null} disables counting
   * @param metricPrefix counter prefix; defaults to {@code lookout.records}
   */
  public LoggingRecordListener(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "lookout.records" : metricPrefix.trim();
  }

  public LoggingRecordListener(MetricsPort metrics) {
    this(metrics, "lookout.records");
  }

  @Override
  public void onRecord(SessionRecord record) {
    Objects.requireNonNull(record, "record");
    metrics.increment(metricPrefix + "." + record.type().name().toLowerCase(Locale.ROOT));
    if (log.isDebugEnabled()) {
      log.debug("session.record {}", describe(record));
    }
  }

  static String describe(SessionRecord record) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("type=" + record.type().wireName());
    joiner.add("ts=" + record.timestamp());
    if (record.uuid() != null) {
      joiner.add("uuid=" + record.uuid());
    }
    if (record.subAgent()) {
      joiner.add("agent=" + record.header().agentId());
    }
    if (record instanceof AssistantRecord assistant) {
      joiner.add("model=" + assistant.model());
      for (ContentBlock block : assistant.content()) {
        if (block instanceof ToolUseBlock use) {
          joiner.add("tool=" + use.name() + "#" + use.id());
        } else if (block instanceof TextBlock text) {
          joiner.add("text=\"" + Logs.preview(text.text(), PREVIEW_BYTES) + '"');
        }
      }
      joiner.add("tokens=" + assistant.usage().totalTokens());
    } else if (record instanceof UserRecord user) {
      if (user.text() != null && !user.text().isBlank()) {
        joiner.add("text=\"" + Logs.preview(user.text(), PREVIEW_BYTES) + '"');
      }
      for (ToolResultBlock result : user.toolResults()) {
        joiner.add("result=" + result.toolUseId() + (result.error() ? "(error)" : "(ok)"));
      }
    } else if (record instanceof SystemRecord system) {
      joiner.add("level=" + system.level());
      joiner.add("content=\"" + Logs.preview(system.content(), PREVIEW_BYTES) + '"');
    } else if (record instanceof SummaryRecord summary) {
      joiner.add("summary=\"" + Logs.preview(summary.summary(), PREVIEW_BYTES) + '"');
    } else if (record instanceof FileHistorySnapshotRecord snapshot) {
      joiner.add("backups=" + snapshot.backups().size());
    }
    return joiner.toString();
  }
}
