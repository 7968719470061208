package ca.gc.cra.lookout.application.monitor;

/**
 * Lifecycle states of the session monitor.
 *
 * @since 0.1.0
 */
public enum MonitorState {
  /** Not watching; {@code start} is permitted. */
  STOPPED,
  /** Resolving the target and registering watches. */
  STARTING,
  /** Poll loop running; records are emitted. */
  WATCHING
}
