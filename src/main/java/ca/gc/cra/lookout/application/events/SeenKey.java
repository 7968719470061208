package ca.gc.cra.lookout.application.events;

import ca.gc.cra.lookout.domain.record.SessionRecord;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of a logical record for deduplication.
 *
 * <p>Records with a unique id are keyed by it; others (summaries, file-history snapshots) are keyed by type,
 * timestamp and a SHA-256 digest of the raw line.</p>
 *
 * @param value key text; never {@code null}
 * @since 0.1.0
 */
public record SeenKey(String value) {
  public SeenKey {
    Objects.requireNonNull(value, "value");
  }

  /**
   * Derives the key for a parsed record.
   *
   * @param record parsed record
   * @param rawLine line the record was parsed from
   * @return dedup key
   */
  public static SeenKey of(SessionRecord record, String rawLine) {
    Objects.requireNonNull(record, "record");
    if (record.header().hasUuid()) {
      return new SeenKey("uuid:" + record.uuid());
    }
    return new SeenKey(record.type().wireName() + '|' + record.timestamp() + '|' + sha256(rawLine));
  }

  private static String sha256(String rawLine) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(Objects.requireNonNullElse(rawLine, "").getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
