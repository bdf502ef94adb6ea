package org.hypertrace.logalert.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.datamodel.LogLevel;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;

/**
 * Fires when no log of the batch within the window matches the optional level and pattern. An
 * invalid pattern does not fire.
 */
public class AbsenceRuleEvaluator extends ConditionRuleEvaluator {

  static final String PATTERN = "pattern";
  static final String LEVEL = "level";
  static final String WINDOW = "window";
  static final long DEFAULT_WINDOW_SECONDS = 300;

  @Override
  public AlertCondition getCondition() {
    return AlertCondition.ABSENCE;
  }

  @Override
  EvaluationResult evaluate(
      RuleParameters parameters,
      List<LogEntry> logEntries,
      MetricsHistory metricsHistory,
      Instant now,
      Map<String, Object> context) {
    Optional<String> pattern = parameters.getString(PATTERN);
    LogLevel level = parameters.getLevel(LEVEL).orElse(null);
    Duration window = parameters.getWindow(WINDOW, DEFAULT_WINDOW_SECONDS);

    List<LogEntry> logsInWindow =
        EvaluatorUtil.filterByLevelAndWindow(logEntries, level, now.minus(window), now);
    List<LogEntry> matches =
        pattern.isPresent()
            ? EvaluatorUtil.filterByPattern(logsInWindow, Pattern.compile(pattern.get()))
            : logsInWindow;

    context.put("pattern", pattern.orElse(null));
    context.put("level", level == null ? null : level.name());
    context.put("window_seconds", EvaluatorUtil.windowSeconds(window));
    context.put("logs_in_window", logsInWindow.size());
    context.put("matches", matches.size());

    return EvaluationResult.of(matches.isEmpty(), context);
  }
}
