package ca.gc.cra.lookout.application.monitor;

import ca.gc.cra.lookout.application.events.BoundedDeduplicator;
import ca.gc.cra.lookout.application.events.RecordEventBus;
import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.application.port.ClockPort;
import ca.gc.cra.lookout.application.port.DirectoryWatchPort;
import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.MonitorErrorListener;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.application.port.Subscription;
import ca.gc.cra.lookout.config.MonitorConfig;
import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import ca.gc.cra.lookout.domain.tail.MonitorTarget;
import ca.gc.cra.lookout.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Tails the JSONL logs of one agent session and publishes typed, de-duplicated
 * records.
 * <p><strong>Why:</strong> The agent creates its log directory and files on its own schedule; the monitor
 * must be started first and cope with directories and files that appear later.</p>
 * <p><strong>Role:</strong> Application use case owning discovery, tail state, the poll loop and watches.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the target (session id, working directory or project directory) on {@link #start}.</li>
 *   <li>Run a fixed-delay poll loop and accept change notifications; both call the same track + read path.</li>
 *   <li>Select the primary file, treat every other file as a sub-agent sidecar, and honor the creation
 *   tolerance window and the include-existing flag. A session-id target tracks only its own file and
 *   sub-agent sidecars, and drops sidecar records stamped with another session's id.</li>
 *   <li>Guarantee that no exception in the tailing path terminates the poll loop.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lifecycle methods synchronize on an internal lock; tail state lives in
 * concurrent maps and per-file guards. Records are delivered serialized by the {@link RecordEventBus}.</p>
 * <p><strong>Observability:</strong> MDC key {@code pipeline=monitor} on worker threads; metrics
 * {@code lookout.discovery.tracked} and {@code lookout.tail.readDropped} plus those of the tailer and bus.</p>
 *
 * @since 0.1.0
 */
public final class SessionMonitor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SessionMonitor.class);

  private final MonitorConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final WatchPortFactory watchPortFactory;
  private final RecordEventBus bus;
  private final BoundedDeduplicator deduplicator;
  private final FileDiscovery discovery;
  private final FileTailer tailer;
  private final ScheduledExecutorService scheduler;
  private final ExecutorService readers;

  private final Map<Path, TrackedFile> tracked = new ConcurrentHashMap<>();
  private final Set<Path> ignored = ConcurrentHashMap.newKeySet();
  private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.STOPPED);
  private final Object lifecycleLock = new Object();
  private final Object trackLock = new Object();

  private volatile MonitorTarget target;
  private volatile Instant watchStart;
  private volatile Path projectDirectory;
  private volatile Path primaryPath;
  private volatile String sessionId;
  private volatile boolean projectWatched;
  private volatile boolean closed;
  private DirectoryWatchPort watchPort = DirectoryWatchPort.POLLING_ONLY;
  private ScheduledFuture<?> pollTask;

  /**
   * Opens the watch port used while the monitor is running.
   */
  @FunctionalInterface
  public interface WatchPortFactory {
    /**
     * Opens a new watch port.
     *
     * @return watch port
     * @throws IOException when notifications are unavailable
     */
    DirectoryWatchPort open() throws IOException;
  }

  /**
   * Creates a monitor.
   *
   * @param config monitor settings
   * @param watchPortFactory source of file-system notifications; ignored when watching is disabled
   * @param clock time source for the tolerance window
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public SessionMonitor(
      MonitorConfig config, WatchPortFactory watchPortFactory, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.watchPortFactory = Objects.requireNonNull(watchPortFactory, "watchPortFactory");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.deduplicator = new BoundedDeduplicator(config.dedupCapacity());
    this.bus = new RecordEventBus(deduplicator, this.metrics);
    this.discovery = new FileDiscovery(config.subAgentPrefix());
    this.tailer = new FileTailer(new RecordParser(), bus, this.metrics, config.maxReadBytes());
    this.scheduler = ExecutorFactories.newPollScheduler("lookout-poll", this::onUncaught);
    this.readers = ExecutorFactories.newReaderPool(config.readWorkers(), "lookout-read", this::onUncaught);
  }

  /**
   * Creates a polling-only monitor using the system clock and no metrics.
   *
   * @param config monitor settings
   */
  public SessionMonitor(MonitorConfig config) {
    this(config, () -> DirectoryWatchPort.POLLING_ONLY, ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Starts watching {@code target}.
   *
   * <p>Tail state from a previous run is cleared; the dedup set is kept so a re-scan does not re-emit
   * records. Calling {@code start} while already running is a no-op.</p>
   *
   * @param newTarget what to watch
   * @throws IllegalStateException when the monitor was closed
   */
  public void start(MonitorTarget newTarget) {
    Objects.requireNonNull(newTarget, "target");
    synchronized (lifecycleLock) {
      if (closed) {
        throw new IllegalStateException("session monitor is closed");
      }
      if (!state.compareAndSet(MonitorState.STOPPED, MonitorState.STARTING)) {
        log.debug("Session monitor already {}; ignoring start for {}", state.get(), newTarget);
        return;
      }
      tracked.clear();
      ignored.clear();
      primaryPath = null;
      projectWatched = false;
      target = newTarget;
      watchStart = clock.now();
      sessionId = newTarget.kind() == MonitorTarget.Kind.SESSION_ID ? newTarget.value() : null;
      projectDirectory = switch (newTarget.kind()) {
        case WORKING_DIRECTORY -> logRoot().resolve(MonitorTarget.sanitize(newTarget.value()));
        case PROJECT_DIRECTORY -> Path.of(newTarget.value()).toAbsolutePath().normalize();
        case SESSION_ID -> null;
      };

      openWatches();
      long intervalMillis = config.pollInterval().toMillis();
      pollTask = scheduler.scheduleWithFixedDelay(this::pollTick, 0, intervalMillis, TimeUnit.MILLISECONDS);
      state.set(MonitorState.WATCHING);
      log.info("Session monitor watching {} {} (logRoot={}, includeExisting={}, tolerance={}s, poll={}ms)",
          newTarget.kind(), newTarget.value(), config.logRoot(), config.includeExisting(),
          config.creationTolerance().toSeconds(), intervalMillis);
    }
  }

  /**
   * Stops the poll loop and tears down watches. In-flight reads finish on their own; records they frame
   * after this call are consumed without being emitted. A no-op when not running.
   */
  public void stop() {
    synchronized (lifecycleLock) {
      if (state.get() == MonitorState.STOPPED) {
        return;
      }
      if (pollTask != null) {
        pollTask.cancel(false);
        pollTask = null;
      }
      watchPort.close();
      watchPort = DirectoryWatchPort.POLLING_ONLY;
      state.set(MonitorState.STOPPED);
      log.info("Session monitor stopped (session={}, files={})", sessionId, tracked.size());
    }
  }

  /** Stops the monitor and releases its threads. Further calls do nothing. */
  @Override
  public void close() {
    synchronized (lifecycleLock) {
      if (closed) {
        return;
      }
      stop();
      closed = true;
    }
    scheduler.shutdownNow();
    readers.shutdown();
    try {
      if (!readers.awaitTermination(2, TimeUnit.SECONDS)) {
        log.warn("Reader threads did not finish within 2s; abandoning in-flight reads");
        readers.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      readers.shutdownNow();
    }
  }

  /**
   * Registers a record subscriber.
   *
   * @param listener subscriber
   * @return handle whose {@code close()} unsubscribes
   */
  public Subscription subscribe(SessionRecordListener listener) {
    return bus.subscribe(listener);
  }

  /**
   * Registers an error-channel observer.
   *
   * @param listener observer
   * @return handle whose {@code close()} unsubscribes
   */
  public Subscription onError(MonitorErrorListener listener) {
    return bus.onError(listener);
  }

  /**
   * Runs discovery and reads every tracked file on the calling thread.
   *
   * <p>Files whose read is already in flight are skipped, as for any other trigger.</p>
   *
   * @throws IllegalStateException when the monitor is not watching
   */
  public void refresh() {
    if (state.get() != MonitorState.WATCHING) {
      throw new IllegalStateException("session monitor is not watching");
    }
    discover();
    for (TrackedFile file : tracked.values()) {
      if (file.tryBeginRead()) {
        readGuarded(file);
      } else {
        metrics.increment("lookout.tail.readDropped");
      }
    }
  }

  /**
   * Returns the session id once known: immediately for session-id targets, otherwise after the primary file
   * is discovered.
   *
   * @return session id, or empty
   */
  public Optional<String> sessionId() {
    return Optional.ofNullable(sessionId);
  }

  public MonitorState state() {
    return state.get();
  }

  /**
   * Returns the project directory being watched.
   *
   * @return directory, or empty while a session-id target has not been located
   */
  public Optional<Path> projectDirectory() {
    return Optional.ofNullable(projectDirectory);
  }

  /**
   * Returns the primary session file once discovered.
   *
   * @return primary file path, or empty
   */
  public Optional<Path> primaryFile() {
    return Optional.ofNullable(primaryPath);
  }

  /**
   * Returns a snapshot of the tracked files.
   *
   * @return tracked files in no particular order
   */
  public List<TrackedFile> trackedFiles() {
    return List.copyOf(tracked.values());
  }

  public int dedupSize() {
    return deduplicator.size();
  }

  private void openWatches() {
    if (!config.watchEnabled()) {
      return;
    }
    try {
      watchPort = watchPortFactory.open();
      Path root = logRoot();
      if (projectDirectory != null && !Files.isDirectory(projectDirectory) && Files.isDirectory(root)) {
        watchPort.watch(root, this::onRootChange);
      }
      ensureProjectWatch();
    } catch (IOException | RuntimeException ex) {
      degradeToPolling(ex);
    }
  }

  private void ensureProjectWatch() {
    Path dir = projectDirectory;
    if (projectWatched || dir == null || !Files.isDirectory(dir)) {
      return;
    }
    DirectoryWatchPort port;
    synchronized (lifecycleLock) {
      port = watchPort;
    }
    try {
      port.watch(dir, this::onProjectChange);
      projectWatched = true;
    } catch (IOException | RuntimeException ex) {
      degradeToPolling(ex);
    }
  }

  private void degradeToPolling(Exception ex) {
    synchronized (lifecycleLock) {
      watchPort.close();
      watchPort = DirectoryWatchPort.POLLING_ONLY;
      projectWatched = true;
    }
    log.warn("File-system notifications unavailable; continuing with polling only: {}", ex.getMessage());
    bus.reportError(MonitorDiagnostic.of(
        MonitorDiagnostic.Kind.WATCH, projectDirectory, "Watch registration failed: " + ex.getMessage(), ex));
  }

  private void onRootChange(Path changed) {
    Path dir = projectDirectory;
    if (state.get() != MonitorState.WATCHING || dir == null || !absolute(changed).equals(dir)) {
      return;
    }
    log.debug("Project directory {} appeared", dir);
    ensureProjectWatch();
    triggerAll();
  }

  private void onProjectChange(Path changed) {
    if (state.get() != MonitorState.WATCHING) {
      return;
    }
    try {
      MDC.put("pipeline", "monitor");
      discover();
      Path path = absolute(changed);
      TrackedFile file = tracked.get(path);
      if (file != null) {
        trigger(file);
      } else if (path.equals(projectDirectory)) {
        triggerAll();
      }
    } catch (RuntimeException ex) {
      reportUnexpected(changed, ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void pollTick() {
    if (state.get() != MonitorState.WATCHING) {
      return;
    }
    try {
      MDC.put("pipeline", "monitor");
      ensureProjectWatch();
      triggerAll();
    } catch (RuntimeException ex) {
      reportUnexpected(projectDirectory, ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void triggerAll() {
    discover();
    for (TrackedFile file : tracked.values()) {
      trigger(file);
    }
  }

  /**
   * Idempotently tracks every adoptable file of the project directory, locating it first for session-id
   * targets.
   */
  private void discover() {
    MonitorTarget current = target;
    if (current == null) {
      return;
    }
    if (current.kind() == MonitorTarget.Kind.SESSION_ID && primaryPath == null) {
      Optional<Path> found = discovery.findSessionFile(logRoot(), current.value());
      if (found.isEmpty()) {
        return;
      }
      projectDirectory = absolute(found.get().getParent());
      discovery.candidate(found.get()).ifPresent(this::track);
      ensureProjectWatch();
    }
    Path dir = projectDirectory;
    if (dir == null || !Files.isDirectory(dir)) {
      return;
    }
    for (FileDiscovery.Candidate candidate : discovery.scan(dir)) {
      track(candidate);
    }
  }

  private void track(FileDiscovery.Candidate candidate) {
    Path path = candidate.path();
    if (tracked.containsKey(path) || ignored.contains(path)) {
      return;
    }
    synchronized (trackLock) {
      if (tracked.containsKey(path) || ignored.contains(path)) {
        return;
      }
      MonitorTarget current = target;
      boolean sessionScoped = current != null && current.kind() == MonitorTarget.Kind.SESSION_ID;
      boolean sessionFile = sessionScoped
          && path.getFileName().toString().equals(current.value() + FileDiscovery.EXTENSION);
      if (sessionScoped && !sessionFile && !candidate.sidecar()) {
        ignored.add(path);
        log.debug("Ignoring {}: not session {} or one of its sidecars", path, current.value());
        return;
      }
      boolean fresh = FileDiscovery.createdSince(candidate, watchStart, config.creationTolerance());
      long initialOffset = 0;
      if (!fresh && !config.includeExisting()) {
        if (!sessionFile) {
          ignored.add(path);
          log.debug("Ignoring {} created at {} before watch start {}", path, candidate.createdAt(), watchStart);
          return;
        }
        initialOffset = sizeOf(path);
      }

      boolean primary = false;
      if (!candidate.sidecar()) {
        if (current != null && current.kind() == MonitorTarget.Kind.SESSION_ID) {
          primary = sessionFile;
        } else {
          primary = primaryPath == null;
        }
      }
      if (primary) {
        primaryPath = path;
        if (sessionId == null) {
          sessionId = discovery.subAgentId(path);
        }
      }
      TrackedFile file = new TrackedFile(path, primary, primary ? null : discovery.subAgentId(path), initialOffset);
      tracked.put(path, file);
      metrics.increment("lookout.discovery.tracked");
      log.info("Tracking {} file {} from offset {}", primary ? "primary" : "sub-agent", path, initialOffset);
    }
  }

  private void trigger(TrackedFile file) {
    if (!file.tryBeginRead()) {
      metrics.increment("lookout.tail.readDropped");
      return;
    }
    try {
      readers.execute(() -> {
        MDC.put("pipeline", "monitor");
        try {
          readGuarded(file);
        } finally {
          MDC.remove("pipeline");
        }
      });
    } catch (RejectedExecutionException ex) {
      file.endRead();
      log.debug("Reader pool rejected read of {}; monitor shutting down", file.path());
    }
  }

  private void readGuarded(TrackedFile file) {
    try {
      String owner = discovery.isSidecar(file.path()) ? sessionId : null;
      FileTailer.ReadResult result = tailer.read(file, () -> state.get() == MonitorState.WATCHING, owner);
      if (result.bytesRead() > 0) {
        log.debug("Read {} bytes from {}: {} lines, {} emitted, {} malformed",
            result.bytesRead(), file.path(), result.lines(), result.emitted(), result.parseFailures());
      }
    } catch (IOException ex) {
      log.debug("Read of {} failed; retrying next tick: {}", file.path(), ex.getMessage());
    } catch (RuntimeException ex) {
      reportUnexpected(file.path(), ex);
    } finally {
      file.endRead();
    }
  }

  private Path logRoot() {
    return absolute(config.logRoot());
  }

  private static Path absolute(Path path) {
    return path.toAbsolutePath().normalize();
  }

  private long sizeOf(Path path) {
    try {
      return Files.size(path);
    } catch (IOException ex) {
      log.debug("Unable to size {}; reading from the beginning: {}", path, ex.getMessage());
      return 0;
    }
  }

  private void reportUnexpected(Path path, RuntimeException ex) {
    log.warn("Unexpected failure while tailing {}", path, ex);
    bus.reportError(MonitorDiagnostic.of(
        MonitorDiagnostic.Kind.IO, path, "Unexpected tailing failure: " + ex.getMessage(), ex));
  }

  private void onUncaught(Thread thread, Throwable ex) {
    log.error("Monitor thread {} terminated unexpectedly", thread.getName(), ex);
  }

  @Override
  public String toString() {
    List<String> files = new ArrayList<>();
    tracked.values().forEach(f -> files.add(f.path().getFileName().toString()));
    return "SessionMonitor{state=" + state.get() + ", session=" + sessionId + ", files=" + files + '}';
  }
}
