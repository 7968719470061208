/**
 * <strong>Purpose:</strong> Discovery, tail state and lifecycle of session log monitoring.
 * <p><strong>Pipeline role:</strong> Application layer; drives the line framer, record parser and event bus.</p>
 * <p><strong>Concurrency:</strong> One poll loop, one optional watch thread and a reader pool share tail state
 * through concurrent maps and per-file guards.</p>
 * <p><strong>Observability:</strong> Logs discovery at INFO and read detail at DEBUG.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application.monitor;
