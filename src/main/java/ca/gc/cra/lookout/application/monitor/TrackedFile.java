package ca.gc.cra.lookout.application.monitor;

import ca.gc.cra.lookout.domain.tail.LineFramer;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Tail state of one session log file.
 * <p><strong>Role:</strong> Holds the read offset, the line framer with its pending tail, and the non-blocking
 * read guard.</p>
 * <p><strong>Thread-safety:</strong> Offset reads are safe from any thread. The framer and offset updates are
 * only touched by the holder of the read guard, see {@link #tryBeginRead()}.</p>
 *
 * @since 0.1.0
 */
public final class TrackedFile {
  private final Path path;
  private final boolean primary;
  private final String subAgentId;
  private final LineFramer framer = new LineFramer();
  private final AtomicLong offset;
  private final AtomicBoolean reading = new AtomicBoolean();

  /**
   * Creates tail state for a discovered file.
   *
   * @param path absolute file path
   * @param primary {@code true} for the primary session file
   * @param subAgentId id attributed to records of a sidecar file; {@code null} for the primary
   * @param initialOffset byte offset where reading starts
   */
  public TrackedFile(Path path, boolean primary, String subAgentId, long initialOffset) {
    this.path = Objects.requireNonNull(path, "path");
    this.primary = primary;
    this.subAgentId = subAgentId;
    if (initialOffset < 0) {
      throw new IllegalArgumentException("initialOffset must be non-negative");
    }
    this.offset = new AtomicLong(initialOffset);
  }

  public Path path() {
    return path;
  }

  public boolean primary() {
    return primary;
  }

  public String subAgentId() {
    return subAgentId;
  }

  /**
   * Returns the number of bytes already consumed.
   *
   * @return read offset
   */
  public long offset() {
    return offset.get();
  }

  /**
   * Returns the bytes buffered for an unterminated last line.
   *
   * @return pending tail length
   */
  public int pendingBytes() {
    return framer.pendingBytes();
  }

  /**
   * Claims the read guard.
   *
   * @return {@code false} when a read is already queued or running, in which case the trigger is dropped
   */
  public boolean tryBeginRead() {
    return reading.compareAndSet(false, true);
  }

  /** Releases the read guard. */
  public void endRead() {
    reading.set(false);
  }

  LineFramer framer() {
    return framer;
  }

  void advance(long bytes) {
    offset.addAndGet(bytes);
  }

  void restartFromBeginning() {
    offset.set(0);
    framer.reset();
  }

  @Override
  public String toString() {
    return "TrackedFile{" + path + ", primary=" + primary + ", offset=" + offset.get() + '}';
  }
}
