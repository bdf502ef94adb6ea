package org.hypertrace.logalert.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.evaluator.metrics.MetricPoint;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Compares the mean of a metric over the window with a static threshold. */
public class ThresholdRuleEvaluator extends ConditionRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdRuleEvaluator.class);

  static final String METRIC = "metric";
  static final String THRESHOLD = "threshold";
  static final String OPERATOR = "operator";
  static final String WINDOW = "window";
  static final String DEFAULT_OPERATOR = ">";
  static final long DEFAULT_WINDOW_SECONDS = 300;

  @Override
  public AlertCondition getCondition() {
    return AlertCondition.THRESHOLD;
  }

  @Override
  EvaluationResult evaluate(
      RuleParameters parameters,
      List<LogEntry> logEntries,
      MetricsHistory metricsHistory,
      Instant now,
      Map<String, Object> context) {
    String metric = parameters.requireString(METRIC);
    double threshold = parameters.requireDouble(THRESHOLD);
    ThresholdOperator operator = getOperator(parameters);
    Duration window = parameters.getWindow(WINDOW, DEFAULT_WINDOW_SECONDS);

    List<Double> values =
        metricsHistory.window(metric, now, window).stream()
            .map(MetricPoint::getValue)
            .collect(Collectors.toList());
    if (values.isEmpty()) {
      LOGGER.debug("No data for metric {} in the last {}", metric, window);
      return EvaluationResult.notTriggered(context);
    }

    double currentValue = EvaluatorUtil.mean(values);
    context.put("metric", metric);
    context.put("current_value", currentValue);
    context.put("threshold", parameters.getRaw(THRESHOLD).orElse(threshold));
    context.put("operator", operator.getSymbol());
    context.put("window_seconds", EvaluatorUtil.windowSeconds(window));
    context.put("data_points", values.size());

    LOGGER.debug(
        "Metric {} mean {} over {} points, threshold {} {}",
        metric,
        currentValue,
        values.size(),
        operator.getSymbol(),
        threshold);
    return EvaluationResult.of(operator.apply(currentValue, threshold), context);
  }

  private static ThresholdOperator getOperator(RuleParameters parameters) {
    String symbol = parameters.getString(OPERATOR).orElse(DEFAULT_OPERATOR);
    try {
      return ThresholdOperator.fromSymbol(symbol.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidRuleParameterException(e.getMessage(), e);
    }
  }
}
