/**
 * Diagnostic events published on the monitor error channel.
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.domain.events;
