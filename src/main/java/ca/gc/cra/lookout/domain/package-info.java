/**
 * <strong>Purpose:</strong> Domain model for LOOKOUT session log observation.
 * <p><strong>Pipeline role:</strong> Framing, typed records and aggregated session values; free of I/O and
 * third-party dependencies.</p>
 * <p><strong>Concurrency:</strong> Value types are immutable; {@code LineFramer} instances are confined to one
 * tracked file.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.domain;
