/**
 * <strong>Purpose:</strong> Metrics adapters implementing {@link ca.gc.cra.lookout.application.port.MetricsPort}.
 * <p><strong>Pipeline role:</strong> Infrastructure; selected by the CLI from {@code metricsExporter}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.infrastructure.metrics;
