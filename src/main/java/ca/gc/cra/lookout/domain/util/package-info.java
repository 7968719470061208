/**
 * Domain utility classes for byte and encoding helpers.
 * <p><strong>Role:</strong> Support functions for the line framer.</p>
 * <p><strong>Concurrency:</strong> Utilities are stateless; safe to call concurrently.</p>
 */
package ca.gc.cra.lookout.domain.util;
