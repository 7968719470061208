package ca.gc.cra.lookout.domain.tail;

import ca.gc.cra.lookout.domain.util.Bytes;
import ca.gc.cra.lookout.domain.util.Utf8;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Turns arbitrarily chunked bytes of a growing file into complete text lines.
 * <p><strong>Role:</strong> Domain service owned by one tracked file; holds the unterminated tail between
 * reads.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Concatenate new bytes with the pending tail and cut at the last {@code '\n'}.</li>
 *   <li>Decode only complete lines so a multi-byte character split across reads is never decoded.</li>
 *   <li>Keep everything after the last line break as the new pending tail.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers serialize access per file.</p>
 * <p><strong>Performance:</strong> One copy of the combined buffer per append; decoding is proportional to
 * the completed lines.</p>
 *
 * @implNote {@code 0x0A} never occurs inside a UTF-8 multi-byte sequence, so splitting on it is byte-safe.
 * @since 0.1.0
 */
public final class LineFramer {
  private static final byte NEWLINE = '\n';

  private byte[] pending = Bytes.empty();

  /**
   * Appends a full chunk.
   *
   * @param chunk bytes read from the file; {@code null} is treated as empty
   * @return complete lines, in order, without terminators
   */
  public List<String> append(byte[] chunk) {
    return append(chunk, 0, chunk == null ? 0 : chunk.length);
  }

  /**
   * Appends a slice of bytes and returns the lines it completes.
   *
   * @param chunk source bytes
   * @param offset slice start
   * @param length slice length
   * @return complete lines in file order; empty when no line break was seen yet
   */
  public List<String> append(byte[] chunk, int offset, int length) {
    byte[] combined = Bytes.concat(pending, chunk, offset, length);
    int lastNewline = Bytes.lastIndexOf(combined, combined.length, NEWLINE);
    if (lastNewline < 0) {
      pending = combined;
      return List.of();
    }

    List<String> lines = new ArrayList<>();
    int start = 0;
    for (int i = 0; i <= lastNewline; i++) {
      if (combined[i] == NEWLINE) {
        lines.add(Utf8.decodeLine(combined, start, i - start));
        start = i + 1;
      }
    }
    int tailLength = combined.length - (lastNewline + 1);
    pending = tailLength == 0
        ? Bytes.empty()
        : Bytes.concat(null, combined, lastNewline + 1, tailLength);
    return lines;
  }

  /**
   * Returns the number of buffered bytes belonging to an unterminated line.
   *
   * @return pending tail length
   */
  public int pendingBytes() {
    return pending.length;
  }

  /** Discards the pending tail, used when the underlying file was truncated. */
  public void reset() {
    pending = Bytes.empty();
  }
}
