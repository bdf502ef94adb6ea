package org.hypertrace.logalert.evaluator;

import static org.hypertrace.logalert.evaluator.EvaluatorTestUtil.NOW;
import static org.hypertrace.logalert.evaluator.EvaluatorTestUtil.log;
import static org.hypertrace.logalert.evaluator.EvaluatorTestUtil.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.datamodel.LogLevel;
import org.hypertrace.logalert.evaluator.metrics.MetricExtractor;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ThresholdRuleEvaluatorTest {
  private final ThresholdRuleEvaluator evaluator = new ThresholdRuleEvaluator();
  private MetricsHistory metricsHistory;

  @BeforeEach
  void setUp() {
    metricsHistory = new MetricsHistory();
  }

  @Test
  void testErrorRateAboveThreshold() {
    List<LogEntry> logEntries =
        List.of(log(LogLevel.ERROR, "a"), log(LogLevel.ERROR, "b"), log(LogLevel.INFO, "c"));
    new MetricExtractor().recordInto(metricsHistory, logEntries, NOW);

    EvaluationResult result =
        evaluator.evaluateRule(
            rule(
                AlertCondition.THRESHOLD,
                Map.of("metric", "error_rate", "threshold", 0.3, "operator", ">")),
            logEntries,
            metricsHistory,
            NOW);

    assertTrue(result.isTriggered());
    assertEquals(2.0 / 3, (double) result.getContext().get("current_value"), 1e-9);
    assertEquals(0.3, result.getContext().get("threshold"));
    assertEquals(">", result.getContext().get("operator"));
    assertEquals(300L, result.getContext().get("window_seconds"));
    assertEquals(1, result.getContext().get("data_points"));
  }

  @Test
  void testMeanOverWindow() {
    metricsHistory.record("api_latency", NOW.minusSeconds(400), 1000);
    metricsHistory.record("api_latency", NOW.minusSeconds(100), 100);
    metricsHistory.record("api_latency", NOW.minusSeconds(50), 300);

    EvaluationResult result =
        evaluator.evaluateRule(
            rule(
                AlertCondition.THRESHOLD,
                Map.of("metric", "api_latency", "threshold", "200", "operator", ">=")),
            List.of(),
            metricsHistory,
            NOW);

    assertTrue(result.isTriggered());
    assertEquals(200.0, result.getContext().get("current_value"));
    assertEquals(2, result.getContext().get("data_points"));
  }

  @Test
  void testOperators() {
    metricsHistory.record("error_rate", NOW, 0.5);

    assertTrue(evaluate("<", 0.6));
    assertFalse(evaluate("<", 0.5));
    assertTrue(evaluate("<=", 0.5));
    assertTrue(evaluate("==", 0.5));
    assertFalse(evaluate("!=", 0.5));
    assertTrue(evaluate("!=", -1));
    assertFalse(evaluate(">", 0.5));
  }

  @Test
  void testFractionalWindow() {
    metricsHistory.record("error_rate", NOW.minusMillis(1000), 0.5);

    EvaluationResult result =
        evaluator.evaluateRule(
            rule(
                AlertCondition.THRESHOLD,
                Map.of("metric", "error_rate", "threshold", 0.1, "window", 0.5)),
            List.of(),
            metricsHistory,
            NOW);

    assertFalse(result.isTriggered());

    metricsHistory.record("error_rate", NOW.minusMillis(200), 0.5);
    result =
        evaluator.evaluateRule(
            rule(
                AlertCondition.THRESHOLD,
                Map.of("metric", "error_rate", "threshold", 0.1, "window", 0.5)),
            List.of(),
            metricsHistory,
            NOW);
    assertTrue(result.isTriggered());
    assertEquals(0.5, result.getContext().get("window_seconds"));
  }

  @Test
  void testNoDataDoesNotTrigger() {
    EvaluationResult result =
        evaluator.evaluateRule(
            rule(
                AlertCondition.THRESHOLD,
                Map.of("metric", "error_rate", "threshold", -1, "operator", ">")),
            List.of(),
            metricsHistory,
            NOW);

    assertFalse(result.isTriggered());
  }

  @Test
  void testMalformedParametersDoNotTrigger() {
    metricsHistory.record("error_rate", NOW, 0.5);

    assertFalse(evaluate(Map.of("threshold", 0.1)));
    assertFalse(evaluate(Map.of("metric", "error_rate")));
    assertFalse(evaluate(Map.of("metric", "error_rate", "threshold", "high")));
    assertFalse(evaluate(Map.of("metric", "error_rate", "threshold", 0.1, "operator", "=~")));
    assertFalse(evaluate(Map.of("metric", "error_rate", "threshold", 0.1, "window", -5)));
  }

  private boolean evaluate(String operator, double threshold) {
    return evaluate(Map.of("metric", "error_rate", "threshold", threshold, "operator", operator));
  }

  private boolean evaluate(Map<String, Object> parameters) {
    return evaluator
        .evaluateRule(rule(AlertCondition.THRESHOLD, parameters), List.of(), metricsHistory, NOW)
        .isTriggered();
  }
}
