package org.hypertrace.logalert.evaluator.metrics;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed capacity ring buffer of metric points. Once full, every append overwrites the oldest
 * point. Reads return points in insertion order.
 */
class MetricTimeSeries {

  private final MetricPoint[] points;
  // index of the oldest point
  private int head;
  private int size;

  MetricTimeSeries(int capacity) {
    Preconditions.checkArgument(capacity > 0, "metric series capacity should be positive");
    this.points = new MetricPoint[capacity];
  }

  synchronized void add(MetricPoint metricPoint) {
    points[(head + size) % points.length] = metricPoint;
    if (size == points.length) {
      head = (head + 1) % points.length;
    } else {
      size++;
    }
  }

  synchronized List<MetricPoint> getPointsSince(Instant startTime) {
    List<MetricPoint> result = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      MetricPoint metricPoint = points[(head + i) % points.length];
      if (!metricPoint.getTimestamp().isBefore(startTime)) {
        result.add(metricPoint);
      }
    }
    return result;
  }

  synchronized List<MetricPoint> getAll() {
    List<MetricPoint> result = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      result.add(points[(head + i) % points.length]);
    }
    return result;
  }

  synchronized int size() {
    return size;
  }

  int capacity() {
    return points.length;
  }
}
