/**
 * <strong>Purpose:</strong> JSON encoders and file/stream writers for records and session statistics.
 * <p><strong>Pipeline role:</strong> Output adapters subscribed to the record bus or used by the CLI.</p>
 * <p><strong>Observability:</strong> Counters {@code lookout.output.ndjson.written} and
 * {@code lookout.output.ndjson.failed}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.infrastructure.output;
