package ca.gc.cra.lookout.infrastructure.events;

import ca.gc.cra.lookout.application.port.MonitorErrorListener;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures records and diagnostics in memory, in delivery order, for callers that inspect a run afterwards.
 *
 * @since 0.1.0
 */
public final class InMemoryRecordListener implements SessionRecordListener, MonitorErrorListener {
  private final CopyOnWriteArrayList<SessionRecord> records = new CopyOnWriteArrayList<>();
  private final CopyOnWriteArrayList<MonitorDiagnostic> diagnostics = new CopyOnWriteArrayList<>();

  @Override
  public void onRecord(SessionRecord record) {
    records.add(Objects.requireNonNull(record, "record"));
  }

  @Override
  public void onError(MonitorDiagnostic diagnostic) {
    diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
  }

  /**
   * Returns a snapshot of received records.
   *
   * @return immutable list in delivery order
   */
  public List<SessionRecord> records() {
    return List.copyOf(records);
  }

  public List<MonitorDiagnostic> diagnostics() {
    return List.copyOf(diagnostics);
  }

  /** Clears captured records and diagnostics. */
  public void clear() {
    records.clear();
    diagnostics.clear();
  }
}
