package ca.gc.cra.cblog.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("correlate.receive.orphaned");
    adapter.increment("correlate.receive.orphaned");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "correlate.receive.orphaned");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("correlate.receive.orphaned", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
    assertEquals("cblog", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void mixedCaseKeysAreSanitizedButKeptAsAttribute() {
    adapter.increment("parse.lines.outsideWindow");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "parse.lines.outsidewindow");
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals("parse.lines.outsideWindow", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("report.window.bytes", 1500);
    adapter.observe("report.window.bytes", 2500);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "report.window.bytes");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2, point.getCount());
    assertEquals(4000.0, point.getSum(), 0.0001);
  }

  @Test
  void sanitizeNameReplacesIllegalCharacters() {
    assertEquals("cblog.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("m1.lines", OpenTelemetryMetricsAdapter.sanitizeName("1.lines"));
    assertEquals("classify.event_sent", OpenTelemetryMetricsAdapter.sanitizeName("classify.event/sent"));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    MetricData match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElse(null);
    assertTrue(match != null, "Expected metric " + name + " to be exported");
    return match;
  }
}
