package ca.gc.cra.lookout.api;

import ca.gc.cra.lookout.application.port.MetricsPort;
import ca.gc.cra.lookout.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.lookout.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} to the JVM system
 * properties read by the OpenTelemetry bootstrap, and selects the metrics adapter.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Validates and applies telemetry settings.
   *
   * @param args effective settings
   * @return normalized exporter name, {@code otlp} or {@code none}
   * @throws IllegalArgumentException when a value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = value(args, "metricsExporter").toLowerCase(Locale.ROOT);
    if (exporter.isEmpty()) {
      exporter = "none";
    }
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    System.setProperty("otel.metrics.exporter", exporter);

    String endpoint = value(args, "otelEndpoint");
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }
    String attributes = value(args, "otelResourceAttributes");
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", attributes);
    }
    return exporter;
  }

  /**
   * Creates the metrics adapter for a normalized exporter name.
   *
   * @param exporter {@code otlp} or {@code none}
   * @return metrics port
   */
  static MetricsPort createMetrics(String exporter) {
    return "otlp".equals(exporter) ? new OpenTelemetryMetricsAdapter() : MetricsPort.NO_OP;
  }

  /** Flushes and closes an OpenTelemetry adapter; other ports are left alone. */
  static void shutdown(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String value(Map<String, String> args, String key) {
    String value = args == null ? null : args.get(key);
    return value == null ? "" : value.trim();
  }
}
