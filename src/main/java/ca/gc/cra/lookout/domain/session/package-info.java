/**
 * <strong>Purpose:</strong> Aggregated session view: counters, correlations, ledgers and sub-agent activity.
 * <p><strong>Pipeline role:</strong> Domain values published by the session aggregator.</p>
 * <p><strong>Concurrency:</strong> Immutable snapshots; safe to share.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.domain.session;
