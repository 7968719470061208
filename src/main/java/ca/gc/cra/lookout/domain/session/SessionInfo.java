package ca.gc.cra.lookout.domain.session;

import java.time.Instant;

/**
 * Descriptive attributes of the observed session, taken from the first record that carries each.
 *
 * @param sessionId session id, or {@code null} before any record
 * @param cwd agent working directory, or {@code null}
 * @param version agent CLI version, or {@code null}
 * @param gitBranch git branch, or {@code null}
 * @param slug session slug, or {@code null}
 * @param startedAt earliest record timestamp, or {@code null}
 * @param lastActivityAt latest record timestamp, or {@code null}
 * @since 0.1.0
 */
public record SessionInfo(
    String sessionId,
    String cwd,
    String version,
    String gitBranch,
    String slug,
    Instant startedAt,
    Instant lastActivityAt) {

  /** Info before any record was observed. */
  public static final SessionInfo EMPTY = new SessionInfo(null, null, null, null, null, null, null);
}
