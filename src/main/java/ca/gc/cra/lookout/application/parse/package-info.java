/**
 * <strong>Purpose:</strong> JSON line parsing into typed session records.
 * <p><strong>Pipeline role:</strong> Application layer between the line framer and the deduplicator.</p>
 * <p><strong>Concurrency:</strong> Parsers are stateless and shared across reader threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application.parse;
