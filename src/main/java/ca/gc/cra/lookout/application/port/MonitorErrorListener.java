package ca.gc.cra.lookout.application.port;

import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;

/**
 * Observer of the monitor error side-channel.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MonitorErrorListener {
  /**
   * Handles one diagnostic.
   *
   * @param diagnostic non-fatal problem; never {@code null}
   */
  void onError(MonitorDiagnostic diagnostic);

  /** Listener that ignores diagnostics. */
  MonitorErrorListener NO_OP = diagnostic -> {};
}
