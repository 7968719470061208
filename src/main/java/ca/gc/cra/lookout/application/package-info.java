/**
 * <strong>Purpose:</strong> Use cases and ports of LOOKOUT: record parsing, de-duplicated fan-out, the live
 * session monitor, offline replay and session aggregation.
 * <p><strong>Dependencies:</strong> Domain types and ports only; concrete I/O lives in
 * {@code ca.gc.cra.lookout.infrastructure} and {@code ca.gc.cra.lookout.adapter}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.application;
