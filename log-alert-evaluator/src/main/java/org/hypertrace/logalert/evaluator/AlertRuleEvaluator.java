package org.hypertrace.logalert.evaluator;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Routes a rule to the evaluator of its condition kind. */
public class AlertRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertRuleEvaluator.class);

  private final Map<AlertCondition, ConditionRuleEvaluator> evaluators =
      new EnumMap<>(AlertCondition.class);

  public AlertRuleEvaluator() {
    this(
        List.of(
            new PatternRuleEvaluator(),
            new ThresholdRuleEvaluator(),
            new AnomalyRuleEvaluator(),
            new FrequencyRuleEvaluator(),
            new AbsenceRuleEvaluator()));
  }

  // used for testing with substitute evaluators
  AlertRuleEvaluator(List<ConditionRuleEvaluator> conditionRuleEvaluators) {
    for (ConditionRuleEvaluator evaluator : conditionRuleEvaluators) {
      evaluators.put(evaluator.getCondition(), evaluator);
    }
  }

  public EvaluationResult process(
      AlertRule rule, List<LogEntry> logEntries, MetricsHistory metricsHistory, Instant now) {
    ConditionRuleEvaluator evaluator = evaluators.get(rule.getCondition());
    if (evaluator == null) {
      LOGGER.warn(
          "No evaluator for alert condition {} of rule {}", rule.getCondition(), rule.getId());
      return EvaluationResult.notTriggered(EvaluatorUtil.baseContext(logEntries));
    }

    LOGGER.debug("Starting rule evaluation for rule Id {} at {}", rule.getId(), now);
    EvaluationResult result = evaluator.evaluateRule(rule, logEntries, metricsHistory, now);
    LOGGER.debug("Rule id {}, triggered {}", rule.getId(), result.isTriggered());
    return result;
  }
}
