package ca.gc.cra.lookout.config;

import java.util.Locale;

/**
 * Destination type for emitted records.
 *
 * @since 0.1.0
 */
public enum IoMode {
  /** NDJSON written to a file or stdout. */
  FILE,
  /** Records published to an Apache Kafka topic. */
  KAFKA;

  /**
   * Parses a mode name, defaulting to {@link #FILE}.
   *
   * @param value raw value; blank selects {@link #FILE}
   * @return parsed mode
   * @throws IllegalArgumentException for unknown names
   */
  public static IoMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return FILE;
    }
    try {
      return IoMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown outMode: " + value, ex);
    }
  }
}
