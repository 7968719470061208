/**
 * Input validation helpers shared by configuration and CLI code.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 */
package ca.gc.cra.lookout.validation;
