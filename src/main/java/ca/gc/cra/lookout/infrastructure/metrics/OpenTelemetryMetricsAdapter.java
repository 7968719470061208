package ca.gc.cra.lookout.infrastructure.metrics;

import ca.gc.cra.lookout.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Infrastructure adapter created by the CLI when metrics are enabled.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; recording is
 * thread-safe.</p>
 * <p><strong>Observability:</strong> Each instrument carries a {@code lookout.metric.key} attribute holding the
 * unsanitized key.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("lookout.metric.key");
  private static final String FALLBACK_NAME = "lookout.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter using the exporter configured through system properties or environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics disabled; instruments are no-ops");
    }
  }

  /**
   * Creates an adapter exporting to the supplied reader, for example an in-memory reader in tests.
   *
   * @param reader metric reader to register
   * @return adapter bound to a dedicated meter provider
   */
  public static OpenTelemetryMetricsAdapter withReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forReader(reader));
  }

  @Override
  public void increment(String key) {
    Counter instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram instrument = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void flush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter counter(String key) {
    LongCounter counter = meter.counterBuilder(metricName(key))
        .setUnit("1")
        .setDescription("LOOKOUT counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram histogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(metricName(key))
        .ofLongs()
        .setDescription("LOOKOUT observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  /**
   * Maps a key onto the OpenTelemetry instrument name grammar: lower case, starting with a letter, limited to
   * letters, digits, {@code _ - .}.
   */
  static String metricName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
