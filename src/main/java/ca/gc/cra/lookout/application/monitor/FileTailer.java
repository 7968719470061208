package ca.gc.cra.lookout.application.monitor;

import ca.gc.cra.lookout.application.events.RecordEventBus;
import ca.gc.cra.lookout.application.events.SeenKey;
import ca.gc.cra.lookout.application.parse.RecordParser;
import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.domain.events.MonitorDiagnostic;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.logging.Logs;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Performs one read pass over a tracked file.
 * <p><strong>Role:</strong> Shared "read" half of the track + read entry point used by both notification and
 * poll paths.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect truncation and restart from byte zero.</li>
 *   <li>Read at most {@code maxReadBytes} past the offset, frame complete lines and advance the offset by the
 *   bytes consumed.</li>
 *   <li>Parse each line, tag sidecar records, and offer them to the event bus.</li>
 *   <li>Drop sidecar records stamped with another session's id when an owning session is given.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from collaborators; callers must hold the file's read
 * guard.</p>
 * <p><strong>Observability:</strong> Emits {@code lookout.tail.bytes}, {@code lookout.tail.lines},
 * {@code lookout.tail.parseFailed}, {@code lookout.tail.foreignDropped}, {@code lookout.tail.truncated} and
 * {@code lookout.tail.readNanos}.</p>
 *
 * @since 0.1.0
 */
public final class FileTailer {
  private static final Logger log = LoggerFactory.getLogger(FileTailer.class);
  private static final int PREVIEW_BYTES = 160;

  private final RecordParser parser;
  private final RecordEventBus bus;
  private final MetricsPort metrics;
  private final int maxReadBytes;

  public FileTailer(RecordParser parser, RecordEventBus bus, MetricsPort metrics, int maxReadBytes) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (maxReadBytes <= 0) {
      throw new IllegalArgumentException("maxReadBytes must be positive");
    }
    this.maxReadBytes = maxReadBytes;
  }

  /**
   * Outcome of one read pass.
   *
   * @param bytesRead bytes consumed from the file
   * @param lines complete non-blank lines framed
   * @param emitted records accepted by the bus
   * @param parseFailures lines dropped because they were not valid JSON objects
   */
  public record ReadResult(long bytesRead, int lines, int emitted, int parseFailures) {
    /** Result of a pass that found nothing new. */
    public static final ReadResult EMPTY = new ReadResult(0, 0, 0, 0);
  }

  /**
   * Reads new content of {@code file}, emitting every record while {@code accepting} holds.
   *
   * @param file tracked file; caller holds its read guard
   * @param accepting checked before each emission; lines seen while it is false are consumed silently
   * @return read outcome
   * @throws IOException when the file cannot be opened or read; the offset is left unchanged
   */
  public ReadResult read(TrackedFile file, BooleanSupplier accepting) throws IOException {
    return read(file, accepting, null);
  }

  /**
   * Reads new content of {@code file}, dropping sidecar records that belong to another session.
   *
   * @param file tracked file; caller holds its read guard
   * @param accepting checked before each emission; lines seen while it is false are consumed silently
   * @param owningSession session the sidecar must belong to; {@code null} accepts any. Ignored for the primary
   * file and for records without a session id
   * @return read outcome
   * @throws IOException when the file cannot be opened or read; the offset is left unchanged
   */
  public ReadResult read(TrackedFile file, BooleanSupplier accepting, String owningSession) throws IOException {
    long started = System.nanoTime();
    byte[] chunk;
    int read;
    try (FileChannel channel = FileChannel.open(file.path(), StandardOpenOption.READ)) {
      long size = channel.size();
      if (size < file.offset()) {
        metrics.increment("lookout.tail.truncated");
        log.debug("{} shrank from {} to {} bytes; restarting from the beginning", file.path(), file.offset(), size);
        file.restartFromBeginning();
      }
      long available = size - file.offset();
      if (available <= 0) {
        return ReadResult.EMPTY;
      }
      chunk = new byte[(int) Math.min(available, maxReadBytes)];
      read = readFully(channel, file.offset(), chunk);
    }
    if (read <= 0) {
      return ReadResult.EMPTY;
    }

    List<String> lines = file.framer().append(chunk, 0, read);
    file.advance(read);
    metrics.observe("lookout.tail.bytes", read);

    int framed = 0;
    int emitted = 0;
    int failures = 0;
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      framed++;
      metrics.increment("lookout.tail.lines");
      Optional<SessionRecord> parsed;
      try {
        parsed = parser.parse(line);
      } catch (IllegalArgumentException ex) {
        failures++;
        metrics.increment("lookout.tail.parseFailed");
        log.debug("Dropping malformed line in {}: {}", file.path(), Logs.truncate(line, PREVIEW_BYTES));
        bus.reportError(MonitorDiagnostic.of(
            MonitorDiagnostic.Kind.PARSE, file.path(), "Malformed session log line: " + ex.getMessage(), ex));
        continue;
      }
      if (parsed.isEmpty()) {
        log.trace("Ignoring line of unknown type in {}", file.path());
        continue;
      }
      if (!file.primary() && isForeign(parsed.get(), owningSession)) {
        metrics.increment("lookout.tail.foreignDropped");
        log.trace("Dropping record of session {} from {}", parsed.get().sessionId(), file.path());
        continue;
      }
      SessionRecord record = file.primary() ? parsed.get() : parsed.get().asSubAgent(file.subAgentId());
      if (!accepting.getAsBoolean()) {
        continue;
      }
      if (bus.offer(SeenKey.of(record, line), record)) {
        emitted++;
      }
    }
    metrics.observe("lookout.tail.readNanos", System.nanoTime() - started);
    return new ReadResult(read, framed, emitted, failures);
  }

  private static boolean isForeign(SessionRecord record, String owningSession) {
    return owningSession != null && record.sessionId() != null && !owningSession.equals(record.sessionId());
  }

  private static int readFully(FileChannel channel, long position, byte[] target) throws IOException {
    ByteBuffer buffer = ByteBuffer.wrap(target);
    long cursor = position;
    while (buffer.hasRemaining()) {
      int n = channel.read(buffer, cursor);
      if (n < 0) {
        break;
      }
      cursor += n;
    }
    return buffer.position();
  }
}
