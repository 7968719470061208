/**
 * <strong>Purpose:</strong> Record and diagnostic subscribers that log or capture monitor output.
 * <p><strong>Pipeline role:</strong> Infrastructure listeners registered on the record bus.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.infrastructure.events;
