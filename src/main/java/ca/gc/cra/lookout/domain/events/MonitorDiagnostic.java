package ca.gc.cra.lookout.domain.events;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Non-fatal problem observed while tailing session logs.
 * <p><strong>Role:</strong> Payload of the monitor error channel; never interrupts the record stream.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param kind category of the problem; never {@code null}
 * @param path file or directory involved, or {@code null}
 * @param message short description; never {@code null}
 * @param cause underlying exception, or {@code null}
 * @param timestamp instant the problem was observed; never {@code null}
 * @since 0.1.0
 */
public record MonitorDiagnostic(Kind kind, Path path, String message, Throwable cause, Instant timestamp) {

  /** Problem categories. */
  public enum Kind {
    /** A line could not be parsed and was dropped. */
    PARSE,
    /** A file read failed outside the transient retry path. */
    IO,
    /** Watch registration failed; the monitor continues polling only. */
    WATCH,
    /** A subscriber threw while handling a record. */
    LISTENER
  }

  public MonitorDiagnostic {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Creates a diagnostic stamped with the current instant.
   *
   * @param kind category
   * @param path related path, or {@code null}
   * @param message description
   * @param cause underlying exception, or {@code null}
   * @return diagnostic
   */
  public static MonitorDiagnostic of(Kind kind, Path path, String message, Throwable cause) {
    return new MonitorDiagnostic(kind, path, message, cause, Instant.now());
  }
}
