/**
 * <strong>Purpose:</strong> Command-line entry points ({@code watch}, {@code replay}) and their argument,
 * configuration and exit-code handling.
 * <p><strong>Pipeline role:</strong> Composition root wiring configuration, monitor, listeners and output
 * adapters.</p>
 * <p><strong>Observability:</strong> Stdout carries command output only; diagnostics go to the log on
 * stderr.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.api;
