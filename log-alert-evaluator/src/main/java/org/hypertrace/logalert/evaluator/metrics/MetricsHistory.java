package org.hypertrace.logalert.evaluator.metrics;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded per-metric time series. Series are created on first write and kept for the lifetime
 * of the history; each keeps only its most recent {@code capacity} points.
 */
public class MetricsHistory {
  public static final int DEFAULT_CAPACITY = 1000;

  private final int capacity;
  private final ConcurrentMap<String, MetricTimeSeries> metricTimeSeries =
      new ConcurrentHashMap<>();

  public MetricsHistory() {
    this(DEFAULT_CAPACITY);
  }

  public MetricsHistory(int capacity) {
    Preconditions.checkArgument(capacity > 0, "metrics history capacity should be positive");
    this.capacity = capacity;
  }

  /** Values are stored as given, NaN and infinities included. */
  public void record(String metricName, Instant timestamp, double value) {
    Preconditions.checkArgument(metricName != null, "metric name can not be null");
    Preconditions.checkArgument(timestamp != null, "metric timestamp can not be null");
    metricTimeSeries
        .computeIfAbsent(metricName, k -> new MetricTimeSeries(capacity))
        .add(new MetricPoint(timestamp, value));
  }

  /** Points with {@code timestamp >= now - duration} in insertion order. */
  public List<MetricPoint> window(String metricName, Instant now, Duration duration) {
    MetricTimeSeries series = metricTimeSeries.get(metricName);
    if (series == null) {
      return List.of();
    }
    return series.getPointsSince(now.minus(duration));
  }

  public List<MetricPoint> getAll(String metricName) {
    MetricTimeSeries series = metricTimeSeries.get(metricName);
    return series == null ? List.of() : series.getAll();
  }

  public Set<String> getMetricNames() {
    return Set.copyOf(metricTimeSeries.keySet());
  }

  public int getCapacity() {
    return capacity;
  }
}
