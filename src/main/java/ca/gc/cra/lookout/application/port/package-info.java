/**
 * <strong>Purpose:</strong> Ports defining the tail -> parse -> publish workflow contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters implement these interfaces to integrate
 * metrics, clocks, file-system notifications and record sinks.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application.port;
