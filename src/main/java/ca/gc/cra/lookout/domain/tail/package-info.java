/**
 * <strong>Purpose:</strong> Byte-safe framing of appended file content into lines.
 * <p><strong>Concurrency:</strong> Framers are confined to one tracked file and accessed under its read guard.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.domain.tail;
