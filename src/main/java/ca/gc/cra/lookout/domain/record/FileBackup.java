package ca.gc.cra.lookout.domain.record;

import java.time.Instant;
import java.util.Objects;

/**
 * Backup entry tracked by a file-history snapshot.
 *
 * @param path path of the tracked file as written by the agent; never {@code null}
 * @param backupFileName name of the backup copy, or {@code null} when the file did not exist yet
 * @param version backup version counter
 * @param backupTime instant of the backup, or {@code null}
 * @since 0.1.0
 */
public record FileBackup(String path, String backupFileName, int version, Instant backupTime) {
  public FileBackup {
    Objects.requireNonNull(path, "path");
  }
}
