package ca.gc.cra.lookout.config;

import ca.gc.cra.lookout.adapter.kafka.KafkaRecordPublisher;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flattened default settings for each CLI command, derived from {@link MonitorConfig#defaults()}.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {

  private DefaultsForMode() {}

  /**
   * Returns the defaults for {@code mode}.
   *
   * @param mode {@code watch} or {@code replay}
   * @return unmodifiable defaults
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(common());
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "watch" -> {
        defaults.put("includeExisting", "false");
        defaults.put("durationSeconds", "0");
      }
      case "replay" -> defaults.put("pretty", "true");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> common() {
    MonitorConfig monitor = MonitorConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("logRoot", monitor.logRoot().toString());
    map.put("toleranceSeconds", Long.toString(monitor.creationTolerance().toSeconds()));
    map.put("pollMillis", Long.toString(monitor.pollInterval().toMillis()));
    map.put("maxReadBytes", Integer.toString(monitor.maxReadBytes()));
    map.put("dedupCapacity", Integer.toString(monitor.dedupCapacity()));
    map.put("readWorkers", Integer.toString(monitor.readWorkers()));
    map.put("watch", Boolean.toString(monitor.watchEnabled()));
    map.put("subAgentPrefix", monitor.subAgentPrefix());
    map.put("outMode", IoMode.FILE.name());
    map.put("out", "-");
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", KafkaRecordPublisher.DEFAULT_TOPIC);
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return map;
  }
}
