package ca.gc.cra.lookout.domain.session;

import java.time.Instant;

/**
 * Ordered entry of a session ledger (summaries, system notices, errors).
 *
 * @param timestamp instant of the originating record, or {@code null}
 * @param source origin label such as {@code system} or {@code tool_result}
 * @param reference related id (record uuid or tool-use id), or {@code null}
 * @param text entry text
 * @since 0.1.0
 */
public record LedgerEntry(Instant timestamp, String source, String reference, String text) {
  public LedgerEntry {
    source = source == null ? "" : source;
    text = text == null ? "" : text;
  }
}
