/**
 * Session-level aggregation of emitted records.
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application.session;
