package ca.gc.cra.lookout.config;

import ca.gc.cra.lookout.adapter.kafka.KafkaRecordPublisher;
import ca.gc.cra.lookout.validation.Net;
import ca.gc.cra.lookout.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Where emitted records go.
 *
 * @param mode {@link IoMode#FILE} for NDJSON, {@link IoMode#KAFKA} for a Kafka topic
 * @param file NDJSON file; {@code null} writes to stdout
 * @param kafkaBootstrap bootstrap servers; required for {@link IoMode#KAFKA}
 * @param kafkaTopic destination topic
 * @since 0.1.0
 */
public record OutputConfig(IoMode mode, Path file, String kafkaBootstrap, String kafkaTopic) {

  public OutputConfig {
    Objects.requireNonNull(mode, "mode");
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic",
        kafkaTopic == null || kafkaTopic.isBlank() ? KafkaRecordPublisher.DEFAULT_TOPIC : kafkaTopic);
    if (mode == IoMode.KAFKA) {
      kafkaBootstrap = Net.validateBootstrapServers(kafkaBootstrap);
    }
  }

  /** NDJSON to stdout. */
  public static OutputConfig stdout() {
    return new OutputConfig(IoMode.FILE, null, null, null);
  }

  /**
   * Builds the output settings from {@code outMode}, {@code out}, {@code kafkaBootstrap} and
   * {@code kafkaTopic}. An {@code out} of {@code -} or blank means stdout.
   *
   * @param args merged settings
   * @return output configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static OutputConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    IoMode mode = IoMode.fromString(args.get("outMode"));
    Path file = Optional.ofNullable(args.get("out"))
        .map(String::trim)
        .filter(v -> !v.isEmpty() && !v.equals("-"))
        .map(Path::of)
        .orElse(null);
    return new OutputConfig(mode, file, args.get("kafkaBootstrap"), args.get("kafkaTopic"));
  }

  public boolean toStdout() {
    return mode == IoMode.FILE && file == null;
  }
}
