package ca.gc.cra.lookout.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Port delivering file-system change notifications for directories.
 * <p><strong>Why:</strong> Notifications shorten discovery latency; the monitor still polls because
 * notifications are not reliable on every platform.</p>
 * <p><strong>Role:</strong> Outbound port implemented by {@code NioDirectoryWatchAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow {@link #watch} and {@link #close} from any
 * thread; callbacks arrive on an adapter-owned thread.</p>
 *
 * @since 0.1.0
 */
public interface DirectoryWatchPort extends AutoCloseable {
  /**
   * Starts watching {@code directory} for created and modified entries.
   *
   * <p>Registering the same directory again is a no-op.</p>
   *
   * @param directory existing directory to watch
   * @param onChange callback receiving the absolute path of each changed entry
   * @throws IOException when the directory cannot be registered
   */
  void watch(Path directory, Consumer<Path> onChange) throws IOException;

  /** Stops all watches; further calls do nothing. */
  @Override
  void close();

  /** Port that never reports changes, leaving discovery to the poll loop. */
  DirectoryWatchPort POLLING_ONLY = new DirectoryWatchPort() {
    @Override public void watch(Path directory, Consumer<Path> onChange) {}

    @Override public void close() {}
  };
}
