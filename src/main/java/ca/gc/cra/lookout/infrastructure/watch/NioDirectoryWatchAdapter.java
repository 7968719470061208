package ca.gc.cra.lookout.infrastructure.watch;

import ca.gc.cra.lookout.application.port.DirectoryWatchPort;
import ca.gc.cra.lookout.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DirectoryWatchPort} backed by {@link WatchService}.
 * <p><strong>Role:</strong> Infrastructure adapter that turns create/modify events into callbacks with the
 * changed entry's absolute path.</p>
 * <p><strong>Thread-safety:</strong> Registrations are tracked in a concurrent map; callbacks run on a single
 * daemon thread started with the first registration.</p>
 * <p><strong>Observability:</strong> Logs registration and callback failures.</p>
 *
 * @implNote On {@code OVERFLOW} the watched directory itself is reported so the caller rescans it.
 * @since 0.1.0
 */
public final class NioDirectoryWatchAdapter implements DirectoryWatchPort {
  private static final Logger log = LoggerFactory.getLogger(NioDirectoryWatchAdapter.class);
  private static final long POLL_MILLIS = 250;

  private final WatchService watchService;
  private final Map<WatchKey, Registration> registrations = new ConcurrentHashMap<>();
  private final Map<Path, WatchKey> keysByDirectory = new ConcurrentHashMap<>();
  private final Object lifecycleLock = new Object();
  private Thread loop;
  private volatile boolean closed;

  /**
   * Opens a watch service on the default file system.
   *
   * @throws IOException when the platform cannot provide a watch service
   */
  public NioDirectoryWatchAdapter() throws IOException {
    this(FileSystems.getDefault().newWatchService());
  }

  NioDirectoryWatchAdapter(WatchService watchService) {
    this.watchService = Objects.requireNonNull(watchService, "watchService");
  }

  @Override
  public void watch(Path directory, Consumer<Path> onChange) throws IOException {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(onChange, "onChange");
    Path normalized = directory.toAbsolutePath().normalize();
    synchronized (lifecycleLock) {
      if (closed) {
        throw new IOException("watch adapter is closed");
      }
      if (keysByDirectory.containsKey(normalized)) {
        return;
      }
      WatchKey key = normalized.register(
          watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
      registrations.put(key, new Registration(normalized, onChange));
      keysByDirectory.put(normalized, key);
      log.debug("Watching directory {}", normalized);
      if (loop == null) {
        loop = ExecutorFactories.threadFactory("lookout-watch", "lookout-watch",
            (t, ex) -> log.error("Watch loop {} terminated unexpectedly", t.getName(), ex))
            .newThread(this::runLoop);
        loop.start();
      }
    }
  }

  @Override
  public void close() {
    Thread current;
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      closed = true;
      current = loop;
    }
    try {
      watchService.close();
    } catch (IOException ex) {
      log.warn("Failed to close watch service", ex);
    }
    if (current != null) {
      current.interrupt();
    }
    registrations.clear();
    keysByDirectory.clear();
  }

  private void runLoop() {
    while (!closed) {
      WatchKey key;
      try {
        key = watchService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      } catch (ClosedWatchServiceException ex) {
        return;
      }
      if (key == null) {
        continue;
      }
      Registration registration = registrations.get(key);
      if (registration != null) {
        dispatch(key, registration);
      }
      if (!key.reset()) {
        registrations.remove(key);
        if (registration != null) {
          keysByDirectory.remove(registration.directory());
          log.debug("Watch on {} is no longer valid", registration.directory());
        }
      }
    }
  }

  private void dispatch(WatchKey key, Registration registration) {
    for (WatchEvent<?> event : key.pollEvents()) {
      Path changed;
      if (event.kind() == StandardWatchEventKinds.OVERFLOW || !(event.context() instanceof Path relative)) {
        changed = registration.directory();
      } else {
        changed = registration.directory().resolve(relative);
      }
      try {
        registration.onChange().accept(changed);
      } catch (RuntimeException ex) {
        log.warn("Watch callback failed for {}", changed, ex);
      }
    }
  }

  private record Registration(Path directory, Consumer<Path> onChange) {}
}
