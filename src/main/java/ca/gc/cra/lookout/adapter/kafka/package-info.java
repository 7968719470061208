/**
 * <strong>Purpose:</strong> Kafka output adapter for session records.
 * <p><strong>Pipeline role:</strong> KAFKA output mode of the {@code watch} and {@code replay} commands.</p>
 * <p><strong>Observability:</strong> Counters {@code lookout.output.kafka.sent} and
 * {@code lookout.output.kafka.failed}; failures are logged at ERROR.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.lookout.adapter.kafka;
