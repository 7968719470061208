/**
 * <strong>Purpose:</strong> Logging configuration and preview helpers shared by CLI and pipeline code.
 * <p><strong>Pipeline role:</strong> Cross-cutting; used by every layer.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.logging;
