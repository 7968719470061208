package ca.gc.cra.lookout.domain.util;

/**
 * <strong>What:</strong> Byte array helpers used by the line framer.
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear scans and single array copies; no intermediate buffers.</p>
 *
 * @since 0.1.0
 */
public final class Bytes {
  private static final byte[] EMPTY = new byte[0];

  private Bytes() {}

  /**
   * Returns a shared zero-length array.
   *
   * @return empty array; callers must not rely on identity
   */
  public static byte[] empty() {
    return EMPTY;
  }

  /**
   * Finds the last occurrence of {@code value} within {@code [0, length)}.
   *
   * @param a source array; may be {@code null}
   * @param length number of leading bytes to search
   * @param value byte to locate
   * @return index of the last match, or {@code -1}
   */
  public static int lastIndexOf(byte[] a, int length, byte value) {
    if (a == null) {
      return -1;
    }
    for (int i = Math.min(length, a.length) - 1; i >= 0; i--) {
      if (a[i] == value) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Concatenates a prefix with a slice of a second array.
   *
   * @param head leading bytes; may be {@code null}
   * @param tail source of trailing bytes; may be {@code null}
   * @param offset start of the slice in {@code tail}
   * @param length slice length
   * @return new array holding {@code head} followed by the slice
   */
  public static byte[] concat(byte[] head, byte[] tail, int offset, int length) {
    int headLength = head == null ? 0 : head.length;
    int tailLength = tail == null ? 0 : Math.max(0, Math.min(length, tail.length - offset));
    if (headLength + tailLength == 0) {
      return EMPTY;
    }
    byte[] out = new byte[headLength + tailLength];
    if (headLength > 0) {
      System.arraycopy(head, 0, out, 0, headLength);
    }
    if (tailLength > 0) {
      System.arraycopy(tail, offset, out, headLength, tailLength);
    }
    return out;
  }
}
