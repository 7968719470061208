package ca.gc.cra.lookout.domain.record;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of the file backups the agent holds before editing files.
 *
 * @param header common fields; type must be {@link RecordType#FILE_HISTORY_SNAPSHOT}
 * @param messageId message the snapshot belongs to, or {@code null}
 * @param snapshotTime instant recorded inside the snapshot, or {@code null}
 * @param update {@code true} when the line updates an earlier snapshot
 * @param backups tracked file backups in document order
 * @since 0.1.0
 */
public record FileHistorySnapshotRecord(
    RecordHeader header,
    String messageId,
    Instant snapshotTime,
    boolean update,
    List<FileBackup> backups) implements SessionRecord {

  public FileHistorySnapshotRecord {
    Objects.requireNonNull(header, "header");
    if (header.type() != RecordType.FILE_HISTORY_SNAPSHOT) {
      throw new IllegalArgumentException("header type must be FILE_HISTORY_SNAPSHOT");
    }
    backups = backups == null ? List.of() : List.copyOf(backups);
  }

  @Override
  public FileHistorySnapshotRecord asSubAgent(String fallbackAgentId) {
    return new FileHistorySnapshotRecord(
        header.asSubAgent(fallbackAgentId), messageId, snapshotTime, update, backups);
  }
}
