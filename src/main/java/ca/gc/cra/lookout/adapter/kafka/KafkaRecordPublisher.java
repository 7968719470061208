package ca.gc.cra.lookout.adapter.kafka;

import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.application.port.SessionRecordListener;
import ca.gc.cra.lookout.domain.record.SessionRecord;
import ca.gc.cra.lookout.infrastructure.output.RecordJsonEncoder;
import ca.gc.cra.lookout.validation.Net;
import ca.gc.cra.lookout.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes session records to a Kafka topic as JSON.
 *
 * <p>The record key is the session id so all records of a session land on one partition in emission order.
 * Sub-agent records without a session id of their own are keyed with the monitored session id.</p>
 *
 * @implNote Sends are asynchronous; {@link #close()} flushes and waits up to five seconds.
 * @since 0.1.0
 */
public final class KafkaRecordPublisher implements SessionRecordListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(KafkaRecordPublisher.class);
  /** Topic used when none is configured. */
  public static final String DEFAULT_TOPIC = "lookout.records";

  private final Producer<String, String> producer;
  private final String topic;
  private final Supplier<String> fallbackKey;
  private final RecordJsonEncoder encoder;
  private final MetricsPort metrics;

  /**
   * Creates a publisher backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated {@code host:port} list
   * @param topic destination topic
   * @param fallbackKey supplies the key for records without a session id
   * @param metrics metrics adapter; may be {@code null}
   */
  public KafkaRecordPublisher(
      String bootstrapServers, String topic, Supplier<String> fallbackKey, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, fallbackKey, metrics);
  }

  KafkaRecordPublisher(
      Producer<String, String> producer, String topic, Supplier<String> fallbackKey, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("kafkaTopic", topic);
    this.fallbackKey = fallbackKey == null ? () -> null : fallbackKey;
    this.encoder = new RecordJsonEncoder();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void onRecord(SessionRecord record) {
    Objects.requireNonNull(record, "record");
    String key = record.sessionId() != null ? record.sessionId() : fallbackKey.get();
    producer.send(new ProducerRecord<>(topic, key, encoder.encode(record)), (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("lookout.output.kafka.failed");
        log.error("Kafka publish to {} failed for {} record {}", topic, record.type(), record.uuid(), ex);
      } else {
        metrics.increment("lookout.output.kafka.sent");
      }
    });
  }

  public String topic() {
    return topic;
  }

  /** Flushes pending records and closes the producer. */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, Net.validateBootstrapServers(bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
