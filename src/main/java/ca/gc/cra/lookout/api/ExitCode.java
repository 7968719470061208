package ca.gc.cra.lookout.api;

/**
 * <strong>What:</strong> Process exit codes returned by LOOKOUT commands.
 * <p><strong>Why:</strong> Scripts wrapping {@code lookout watch} need to tell bad arguments from I/O trouble
 * and interruption.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments were malformed or incomplete. */
  INVALID_ARGS(2),
  /** A file or directory could not be read or written. */
  IO_ERROR(3),
  /** Configuration values were inconsistent at run time. */
  CONFIG_ERROR(4),
  /** An unexpected failure occurred. */
  RUNTIME_FAILURE(5),
  /** The process was interrupted, typically by SIGINT. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
