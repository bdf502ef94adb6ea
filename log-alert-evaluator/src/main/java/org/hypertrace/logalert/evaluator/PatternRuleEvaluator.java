package org.hypertrace.logalert.evaluator;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fires when at least {@code min_matches} messages of the batch match {@code pattern}. */
public class PatternRuleEvaluator extends ConditionRuleEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(PatternRuleEvaluator.class);

  static final String PATTERN = "pattern";
  static final String MIN_MATCHES = "min_matches";
  static final int DEFAULT_MIN_MATCHES = 1;
  static final int MAX_MATCHING_LOGS = 10;

  @Override
  public AlertCondition getCondition() {
    return AlertCondition.PATTERN;
  }

  @Override
  EvaluationResult evaluate(
      RuleParameters parameters,
      List<LogEntry> logEntries,
      MetricsHistory metricsHistory,
      Instant now,
      Map<String, Object> context) {
    String pattern = parameters.requireString(PATTERN);
    int minMatches = parameters.getInt(MIN_MATCHES, DEFAULT_MIN_MATCHES);
    Pattern regex = Pattern.compile(pattern);

    List<LogEntry> matches = EvaluatorUtil.filterByPattern(logEntries, regex);

    context.put("pattern", pattern);
    context.put("matches", matches.size());
    context.put("min_matches", minMatches);
    context.put(
        "matching_logs",
        matches.stream()
            .limit(MAX_MATCHING_LOGS)
            .map(EvaluatorUtil::summarize)
            .collect(Collectors.toList()));

    LOGGER.debug("Pattern {} matched {} of {} logs", pattern, matches.size(), logEntries.size());
    return EvaluationResult.of(matches.size() >= minMatches, context);
  }
}
