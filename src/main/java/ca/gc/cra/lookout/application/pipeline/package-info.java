/**
 * <strong>Purpose:</strong> Batch use cases built on the monitoring pipeline.
 * <p><strong>Pipeline role:</strong> Application layer; invoked by the {@code replay} CLI command.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application.pipeline;
