package org.hypertrace.logalert.evaluator;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the per-condition evaluators. Configuration problems of a rule (missing or malformed
 * parameters, invalid regular expressions) never leave {@link #evaluateRule}; they are logged and
 * reported as a result that did not trigger.
 */
public abstract class ConditionRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConditionRuleEvaluator.class);

  public abstract AlertCondition getCondition();

  public EvaluationResult evaluateRule(
      AlertRule rule, List<LogEntry> logEntries, MetricsHistory metricsHistory, Instant now) {
    Map<String, Object> context = EvaluatorUtil.baseContext(logEntries);
    try {
      return evaluate(new RuleParameters(rule), logEntries, metricsHistory, now, context);
    } catch (InvalidRuleParameterException e) {
      LOGGER.warn(
          "Skipping {} rule {}: {}", getCondition().getValue(), rule.getId(), e.getMessage());
    } catch (PatternSyntaxException e) {
      LOGGER.error("Invalid regex pattern in rule {}: {}", rule.getId(), e.getPattern(), e);
    }
    return EvaluationResult.notTriggered(context);
  }

  /**
   * @param context pre-filled with the batch summary, to be completed by the evaluator
   */
  abstract EvaluationResult evaluate(
      RuleParameters parameters,
      List<LogEntry> logEntries,
      MetricsHistory metricsHistory,
      Instant now,
      Map<String, Object> context);
}
