/**
 * <strong>Purpose:</strong> Deduplication and ordered delivery of session records.
 * <p><strong>Pipeline role:</strong> Application layer between the record parser and subscribers.</p>
 * <p><strong>Concurrency:</strong> The bus serializes deliveries; the deduplicator is internally
 * synchronized.</p>
 * <p><strong>Observability:</strong> Counts emitted, duplicate and failed deliveries via {@code MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application.events;
