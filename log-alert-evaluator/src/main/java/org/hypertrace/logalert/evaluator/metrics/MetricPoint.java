package org.hypertrace.logalert.evaluator.metrics;

import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class MetricPoint {
  private final Instant timestamp;
  private final double value;
}
