/**
 * <strong>Purpose:</strong> Typed model of agent session log lines.
 * <p><strong>Pipeline role:</strong> Domain layer; produced by the record parser, consumed by subscribers.</p>
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.domain.record;
