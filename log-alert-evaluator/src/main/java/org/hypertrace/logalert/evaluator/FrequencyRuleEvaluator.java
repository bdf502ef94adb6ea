package org.hypertrace.logalert.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.datamodel.LogLevel;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;

/**
 * Fires when more than {@code threshold} logs of the batch, optionally of one level, fall into
 * the window. Logs without a timestamp count as logged now.
 */
public class FrequencyRuleEvaluator extends ConditionRuleEvaluator {

  static final String THRESHOLD = "threshold";
  static final String LEVEL = "level";
  static final String WINDOW = "window";
  static final int DEFAULT_THRESHOLD = 100;
  static final long DEFAULT_WINDOW_SECONDS = 60;

  @Override
  public AlertCondition getCondition() {
    return AlertCondition.FREQUENCY;
  }

  @Override
  EvaluationResult evaluate(
      RuleParameters parameters,
      List<LogEntry> logEntries,
      MetricsHistory metricsHistory,
      Instant now,
      Map<String, Object> context) {
    double threshold = parameters.getDouble(THRESHOLD, DEFAULT_THRESHOLD);
    LogLevel level = parameters.getLevel(LEVEL).orElse(null);
    Duration window = parameters.getWindow(WINDOW, DEFAULT_WINDOW_SECONDS);

    int frequency =
        EvaluatorUtil.filterByLevelAndWindow(logEntries, level, now.minus(window), now).size();

    context.put("frequency", frequency);
    context.put("threshold", parameters.getRaw(THRESHOLD).orElse(DEFAULT_THRESHOLD));
    context.put("level", level == null ? null : level.name());
    context.put("window_seconds", EvaluatorUtil.windowSeconds(window));

    return EvaluationResult.of(frequency > threshold, context);
  }
}
