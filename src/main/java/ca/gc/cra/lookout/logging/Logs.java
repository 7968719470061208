package ca.gc.cra.lookout.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep session content previews short and on one line.
 * <p><strong>Why:</strong> Session logs carry whole prompts, tool output and file contents; operator logs
 * should show only a bounded preview.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxBytes} UTF-8 bytes, never splitting a character.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} unchanged when it fits, otherwise the prefix followed by
   *     {@code "... (truncated, N of M bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String prefix;
    try {
      CharBuffer chars = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      prefix = chars.toString();
    } catch (CharacterCodingException ex) {
      prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
    }
    return prefix + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
  }

  /**
   * Collapses line breaks and tabs to spaces and then truncates.
   *
   * @param value text to preview
   * @param maxBytes byte budget; must be positive
   * @return single-line preview
   */
  public static String preview(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(value.replaceAll("[\\r\\n\\t]+", " ").strip(), maxBytes);
  }
}
