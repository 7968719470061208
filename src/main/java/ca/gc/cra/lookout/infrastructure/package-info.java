/**
 * <strong>Purpose:</strong> Adapters implementing application ports: directory watching, clocks, executors,
 * metrics, record output and listener sinks.
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.infrastructure;
