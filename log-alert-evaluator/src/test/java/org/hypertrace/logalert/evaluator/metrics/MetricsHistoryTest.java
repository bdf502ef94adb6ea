package org.hypertrace.logalert.evaluator.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class MetricsHistoryTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void testUnknownMetricHasEmptyWindow() {
    MetricsHistory metricsHistory = new MetricsHistory();
    assertTrue(metricsHistory.window("error_rate", NOW, Duration.ofMinutes(5)).isEmpty());
    assertTrue(metricsHistory.getMetricNames().isEmpty());
  }

  @Test
  void testWindowKeepsInsertionOrder() {
    MetricsHistory metricsHistory = new MetricsHistory();
    metricsHistory.record("latency", NOW.minusSeconds(600), 1);
    metricsHistory.record("latency", NOW.minusSeconds(120), 2);
    metricsHistory.record("latency", NOW.minusSeconds(300), 3);
    metricsHistory.record("latency", NOW, 4);

    List<MetricPoint> window = metricsHistory.window("latency", NOW, Duration.ofSeconds(300));

    assertEquals(
        List.of(
            new MetricPoint(NOW.minusSeconds(120), 2),
            new MetricPoint(NOW.minusSeconds(300), 3),
            new MetricPoint(NOW, 4)),
        window);
  }

  @Test
  void testOldestPointsAreEvicted() {
    MetricsHistory metricsHistory = new MetricsHistory(3);
    for (int i = 1; i <= 5; i++) {
      metricsHistory.record("log_frequency", NOW.plusSeconds(i), i);
    }

    assertEquals(List.of(3.0, 4.0, 5.0), values(metricsHistory.getAll("log_frequency")));
    assertEquals(
        List.of(4.0, 5.0),
        values(metricsHistory.window("log_frequency", NOW.plusSeconds(5), Duration.ofSeconds(1))));
  }

  @Test
  void testDefaultCapacity() {
    MetricsHistory metricsHistory = new MetricsHistory();
    for (int i = 0; i < 1005; i++) {
      metricsHistory.record("error_rate", NOW, i);
    }

    List<MetricPoint> all = metricsHistory.getAll("error_rate");
    assertEquals(MetricsHistory.DEFAULT_CAPACITY, all.size());
    assertEquals(5.0, all.get(0).getValue());
    assertEquals(1004.0, all.get(all.size() - 1).getValue());
  }

  @Test
  void testDegenerateValuesAreKept() {
    MetricsHistory metricsHistory = new MetricsHistory();
    metricsHistory.record("api_latency", NOW, Double.NaN);
    metricsHistory.record("api_latency", NOW, Double.POSITIVE_INFINITY);

    List<Double> values = values(metricsHistory.getAll("api_latency"));
    assertTrue(Double.isNaN(values.get(0)));
    assertEquals(Double.POSITIVE_INFINITY, values.get(1));
  }

  private static List<Double> values(List<MetricPoint> points) {
    return points.stream().map(MetricPoint::getValue).collect(Collectors.toList());
  }
}
