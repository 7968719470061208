package ca.gc.cra.lookout.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for LOOKOUT.
 *
 * <p>Settings are read from system properties first ({@code otel.metrics.exporter},
 * {@code otel.exporter.otlp.endpoint}, {@code otel.resource.attributes}) and then from the matching
 * {@code OTEL_*} environment variables. Any failure yields a no-op provider.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.lookout";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
  private static final AttributeKey<String> SERVICE_INSTANCE_ID = AttributeKey.stringKey("service.instance.id");

  private OpenTelemetryBootstrap() {
    // Utility
  }

  static BootstrapResult initialize() {
    try {
      String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp");
      if (exporterDisabled(exporter)) {
        log.info("OpenTelemetry metrics exporter disabled (exporter={})", exporter);
        return BootstrapResult.noop();
      }
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      Attributes extras = parseResourceAttributes(
          setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(EXPORT_INTERVAL).build();
      BootstrapResult result = build(reader, extras);
      log.info("OpenTelemetry metrics exporting via OTLP to {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forReader(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extras) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version, extras))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  private static boolean exporterDisabled(String exporter) {
    String normalized = exporter.trim().toLowerCase(Locale.ROOT);
    if (normalized.equals("none")) {
      return true;
    }
    if (!normalized.equals("otlp")) {
      log.warn("Unknown metrics exporter '{}'; using otlp", exporter);
    }
    return false;
  }

  private static Resource resource(String version, Attributes extras) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "lookout")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    String instance = instanceId();
    if (!instance.isBlank()) {
      builder.put(SERVICE_INSTANCE_ID, instance);
    }
    Resource merged = Resource.getDefault().merge(Resource.create(builder.build()));
    return extras.isEmpty() ? merged : merged.merge(Resource.create(extras));
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int idx = entry.indexOf('=');
      if (idx <= 0 || idx == entry.length() - 1) {
        if (!entry.isEmpty()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(entry.substring(0, idx).trim()), entry.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String instanceId() {
    String override = System.getenv("OTEL_RESOURCE_SERVICE_INSTANCE");
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Host name unavailable for service.instance.id", ex);
      return "";
    }
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/lookout/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  private static String setting(String property, String env, String defaultValue) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within 5s");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
