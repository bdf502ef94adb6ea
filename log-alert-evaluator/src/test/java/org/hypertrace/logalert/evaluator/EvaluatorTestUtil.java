package org.hypertrace.logalert.evaluator;

import java.time.Instant;
import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.datamodel.LogLevel;

class EvaluatorTestUtil {
  static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  static LogEntry log(LogLevel level, String message) {
    return log(NOW, level, message);
  }

  static LogEntry log(Instant timestamp, LogLevel level, String message) {
    return LogEntry.builder().timestamp(timestamp).level(level).message(message).build();
  }

  static AlertRule rule(AlertCondition condition, Map<String, Object> parameters) {
    return AlertRule.builder()
        .name(condition.getValue() + " rule")
        .condition(condition)
        .parameters(parameters)
        .build();
  }
}
