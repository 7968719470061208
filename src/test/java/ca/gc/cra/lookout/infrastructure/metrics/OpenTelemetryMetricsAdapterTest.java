package ca.gc.cra.lookout.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = OpenTelemetryMetricsAdapter.withReader(reader);
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("lookout.records.assistant");
    adapter.increment("lookout.records.assistant");
    adapter.increment("lookout.records.assistant");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "lookout.records.assistant")
        .orElseThrow(() -> new AssertionError("Expected counter metric to be exported"));
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("lookout.records.assistant",
        point.getAttributes().get(AttributeKey.stringKey("lookout.metric.key")));

    assertEquals("lookout", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("lookout.read.bytes", 100);
    adapter.observe("lookout.read.bytes", 300);
    adapter.flush();

    MetricData histogram = find(reader.collectAllMetrics(), "lookout.read.bytes").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(400.0, point.getSum(), 0.0001);
  }

  @Test
  void metricNamesAreSanitized() {
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.metricName("9lives"));
    assertEquals("lookout.file_count", OpenTelemetryMetricsAdapter.metricName("Lookout.File Count"));
  }

  @Test
  void resourceAttributesParseSkippingMalformedEntries() {
    var attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=dev, broken, team = ops ,=x");

    assertEquals("dev", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("ops", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(2, attributes.size());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
