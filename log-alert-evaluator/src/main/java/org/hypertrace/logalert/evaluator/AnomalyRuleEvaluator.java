package org.hypertrace.logalert.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.lang3.tuple.Pair;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.evaluator.metrics.MetricPoint;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Z-score of the most recent point of a metric against the earlier points of the window.
 *
 * <p>A baseline with zero standard deviation yields a z-score of 0, so a constant history
 * followed by any jump does not fire. The context flags it with {@code zero_variance}.
 */
public class AnomalyRuleEvaluator extends ConditionRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyRuleEvaluator.class);

  static final String METRIC = "metric";
  static final String SENSITIVITY = "sensitivity";
  static final String WINDOW = "window";
  static final String MIN_DATA_POINTS = "min_data_points";
  static final double DEFAULT_SENSITIVITY = 3.0;
  static final long DEFAULT_WINDOW_SECONDS = 3600;
  static final int DEFAULT_MIN_DATA_POINTS = 10;

  @Override
  public AlertCondition getCondition() {
    return AlertCondition.ANOMALY;
  }

  @Override
  EvaluationResult evaluate(
      RuleParameters parameters,
      List<LogEntry> logEntries,
      MetricsHistory metricsHistory,
      Instant now,
      Map<String, Object> context) {
    String metric = parameters.requireString(METRIC);
    double sensitivity = parameters.getDouble(SENSITIVITY, DEFAULT_SENSITIVITY);
    Duration window = parameters.getWindow(WINDOW, DEFAULT_WINDOW_SECONDS);
    int minDataPoints = parameters.getInt(MIN_DATA_POINTS, DEFAULT_MIN_DATA_POINTS);

    List<Double> values =
        metricsHistory.window(metric, now, window).stream()
            .map(MetricPoint::getValue)
            .collect(Collectors.toList());
    if (values.size() < minDataPoints || values.size() < 2) {
      LOGGER.debug(
          "Not enough data for metric {}: {} points, {} required",
          metric,
          values.size(),
          minDataPoints);
      return EvaluationResult.notTriggered(context);
    }

    List<Double> historical = values.subList(0, values.size() - 1);
    double recent = values.get(values.size() - 1);
    Pair<Double, Double> stats = EvaluatorUtil.meanAndStandardDeviation(historical);
    double mean = stats.getLeft();
    double std = stats.getRight();
    boolean zeroVariance = std == 0;
    double zScore = zeroVariance ? 0 : Math.abs(recent - mean) / std;

    context.put("metric", metric);
    context.put("current_value", recent);
    context.put("mean", mean);
    context.put("std", std);
    context.put("z_score", zScore);
    context.put("zero_variance", zeroVariance);
    context.put("sensitivity", sensitivity);
    context.put("window_seconds", EvaluatorUtil.windowSeconds(window));
    context.put("data_points", values.size());

    LOGGER.debug(
        "Metric {} recent {} mean {} std {} z-score {}", metric, recent, mean, std, zScore);
    return EvaluationResult.of(zScore > sensitivity, context);
  }
}
