package ca.gc.cra.lookout.domain.util;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> UTF-8 decoding helpers for complete line slices.
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single allocation for the resulting {@link String}.</p>
 *
 * @implNote Callers pass only slices that end on a line break, so a multi-byte sequence is never cut.
 * @since 0.1.0
 */
public final class Utf8 {
  private Utf8() {}

  /**
   * Decodes a slice of {@code data} as UTF-8, dropping a single trailing carriage return.
   *
   * @param data source bytes; {@code null} yields an empty string
   * @param offset starting index
   * @param length number of bytes to decode
   * @return decoded line without its terminator
   */
  public static String decodeLine(byte[] data, int offset, int length) {
    if (data == null || length <= 0) {
      return "";
    }
    int start = Math.max(0, Math.min(data.length, offset));
    int len = Math.max(0, Math.min(length, data.length - start));
    if (len > 0 && data[start + len - 1] == '\r') {
      len--;
    }
    if (len == 0) {
      return "";
    }
    return new String(data, start, len, StandardCharsets.UTF_8);
  }
}
