package ca.gc.cra.lookout.application.pipeline;

import ca.gc.cra.lookout.application.events.BoundedDeduplicator;
import ca.gc.cra.lookout.application.events.RecordEventBus;
import ca.gc.cra.lookout.application.monitor.FileDiscovery;
import ca.gc.cra.lookout.application.monitor.FileTailer;
import ca.gc.cra.lookout.application.monitor.TrackedFile;
import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.MonitorErrorListener;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.application.session.SessionAggregator;
import ca.gc.cra.lookout.config.MonitorConfig;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.domain.session.SessionStats;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads a finished session log once, with its sub-agent sidecars, and returns the
 * aggregated statistics.
 * <p><strong>Why:</strong> Offline analysis uses the same framer, parser, dedup and aggregation path as live
 * monitoring, so both produce identical statistics for the same bytes.</p>
 * <p><strong>Role:</strong> Application-layer use case behind the {@code replay} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Locate the session file by path or by id beneath the log root.</li>
 *   <li>Select sidecars in the same directory whose first record belongs to the session.</li>
 *   <li>Stream every complete line through the record bus into a {@link SessionAggregator} and any
 *   additional subscribers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #replay} call builds its own pipeline; instances may be
 * reused sequentially.</p>
 * <p><strong>Observability:</strong> MDC key {@code pipeline=replay}; logs the file set and record count.</p>
 *
 * @implNote An unterminated last line is left unread, as in live monitoring.
 * @since 0.1.0
 */
public final class SessionReplayUseCase {
  private static final Logger log = LoggerFactory.getLogger(SessionReplayUseCase.class);

  private final MonitorConfig config;
  private final MetricsPort metrics;
  private final RecordParser parser = new RecordParser();
  private final FileDiscovery discovery;

  public SessionReplayUseCase(MonitorConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.discovery = new FileDiscovery(config.subAgentPrefix());
  }

  /**
   * Locates {@code <sessionId>.jsonl} beneath the configured log root.
   *
   * @param sessionId session id
   * @return session file
   * @throws NoSuchFileException when no such file exists
   */
  public Path locate(String sessionId) throws NoSuchFileException {
    return discovery.findSessionFile(config.logRoot(), sessionId)
        .orElseThrow(() -> new NoSuchFileException(
            config.logRoot().resolve("*").resolve(sessionId + FileDiscovery.EXTENSION).toString(),
            null, "session log not found under " + config.logRoot()));
  }

  /**
   * Replays a session file and its sidecars.
   *
   * @param sessionFile primary session file
   * @param subscribers extra record subscribers, called after the aggregator in emission order
   * @param errors diagnostic observer; may be {@code null}
   * @return aggregated statistics
   * @throws IOException when a file cannot be read
   */
  public SessionStats replay(
      Path sessionFile, List<SessionRecordListener> subscribers, MonitorErrorListener errors) throws IOException {
    Objects.requireNonNull(sessionFile, "sessionFile");
    Path primary = sessionFile.toAbsolutePath().normalize();
    if (!Files.isRegularFile(primary)) {
      throw new NoSuchFileException(primary.toString());
    }
    String previous = MDC.get("pipeline");
    MDC.put("pipeline", "replay");
    try {
      RecordEventBus bus = new RecordEventBus(new BoundedDeduplicator(config.dedupCapacity()), metrics);
      SessionAggregator aggregator = new SessionAggregator();
      bus.subscribe(aggregator);
      if (subscribers != null) {
        subscribers.forEach(bus::subscribe);
      }
      if (errors != null) {
        bus.onError(errors);
      }
      FileTailer tailer = new FileTailer(parser, bus, metrics, config.maxReadBytes());

      String sessionId = discovery.subAgentId(primary);
      List<TrackedFile> files = new ArrayList<>();
      files.add(new TrackedFile(primary, true, null, 0));
      for (Path sidecar : sidecars(primary.getParent(), sessionId)) {
        files.add(new TrackedFile(sidecar, false, discovery.subAgentId(sidecar), 0));
      }
      log.info("Replaying session {} from {} file(s) in {}", sessionId, files.size(), primary.getParent());

      long emitted = 0;
      for (TrackedFile file : files) {
        emitted += drain(tailer, file, file.primary() ? null : sessionId);
      }
      SessionStats stats = aggregator.snapshot();
      log.info("Replay of session {} complete: {} records emitted, {} tool calls", sessionId, emitted,
          stats.toolCalls());
      return stats;
    } finally {
      if (previous == null) {
        MDC.remove("pipeline");
      } else {
        MDC.put("pipeline", previous);
      }
    }
  }

  /**
   * Replays a session file with no extra subscribers.
   *
   * @param sessionFile primary session file
   * @return aggregated statistics
   * @throws IOException when a file cannot be read
   */
  public SessionStats replay(Path sessionFile) throws IOException {
    return replay(sessionFile, List.of(), null);
  }

  private static long drain(FileTailer tailer, TrackedFile file, String owningSession) throws IOException {
    long emitted = 0;
    while (true) {
      FileTailer.ReadResult result = tailer.read(file, () -> true, owningSession);
      if (result.bytesRead() == 0) {
        break;
      }
      emitted += result.emitted();
    }
    if (file.pendingBytes() > 0) {
      log.debug("{} ends with {} bytes of an unterminated line", file.path(), file.pendingBytes());
    }
    return emitted;
  }

  private List<Path> sidecars(Path directory, String sessionId) {
    List<Path> result = new ArrayList<>();
    for (FileDiscovery.Candidate candidate : discovery.scan(directory)) {
      if (candidate.sidecar() && belongsTo(candidate.path(), sessionId)) {
        result.add(candidate.path());
      }
    }
    return result;
  }

  /** A sidecar belongs to the session when its first parseable record has that session id or none. */
  private boolean belongsTo(Path sidecar, String sessionId) {
    try (BufferedReader reader = Files.newBufferedReader(sidecar, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        Optional<SessionRecord> record = parseQuietly(line);
        if (record.isPresent()) {
          String owner = record.get().sessionId();
          return owner == null || owner.equals(sessionId);
        }
      }
      return false;
    } catch (IOException ex) {
      log.debug("Skipping unreadable sidecar {}: {}", sidecar, ex.getMessage());
      return false;
    }
  }

  private Optional<SessionRecord> parseQuietly(String line) {
    try {
      return parser.parse(line);
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
