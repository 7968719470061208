package ca.gc.cra.lookout.domain.tail;

import java.nio.file.Path;
import java.util.Objects;

/**
 * What the session monitor should watch.
 *
 * @param kind how {@code value} is interpreted; never {@code null}
 * @param value session id, working directory or project directory, depending on {@code kind}
 * @since 0.1.0
 */
public record MonitorTarget(Kind kind, String value) {

  /** Target interpretations. */
  public enum Kind {
    /** Explicit session id; discovery is bypassed and the named log file is located by search. */
    SESSION_ID,
    /** Working directory of the agent; the project directory is derived from it. */
    WORKING_DIRECTORY,
    /** Project log directory given directly. */
    PROJECT_DIRECTORY
  }

  public MonitorTarget {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException(kind + " target must not be blank");
    }
    value = value.trim();
  }

  public static MonitorTarget sessionId(String sessionId) {
    return new MonitorTarget(Kind.SESSION_ID, sessionId);
  }

  public static MonitorTarget workingDirectory(Path workingDirectory) {
    return new MonitorTarget(Kind.WORKING_DIRECTORY, workingDirectory.toString());
  }

  public static MonitorTarget projectDirectory(Path projectDirectory) {
    return new MonitorTarget(Kind.PROJECT_DIRECTORY, projectDirectory.toString());
  }

  /**
   * Derives the project directory name the agent uses for a working directory.
   *
   * <p>Path separators and dots are each replaced by {@code '-'}, so {@code /home/dev/app.v2} becomes
   * {@code -home-dev-app-v2}.</p>
   *
   * @param workingDirectory absolute working directory
   * @return sanitized directory name
   */
  public static String sanitize(String workingDirectory) {
    Objects.requireNonNull(workingDirectory, "workingDirectory");
    StringBuilder out = new StringBuilder(workingDirectory.length());
    for (int i = 0; i < workingDirectory.length(); i++) {
      char c = workingDirectory.charAt(i);
      out.append(c == '/' || c == '\\' || c == '.' ? '-' : c);
    }
    return out.toString();
  }
}
