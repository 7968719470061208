package ca.gc.cra.lookout.application.port;

/**
 * Handle returned when registering a listener.
 *
 * <p>{@link #close()} is idempotent and may be called from within a listener callback.</p>
 *
 * @since 0.1.0
 */
public interface Subscription extends AutoCloseable {
  /** Removes the listener; further calls do nothing. */
  @Override
  void close();

  /**
   * Reports whether the listener still receives events.
   *
   * @return {@code false} once closed
   */
  boolean active();
}
