package org.hypertrace.logalert.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.datamodel.TriggeredAlert;
import org.hypertrace.logalert.evaluator.AlertRuleEvaluator;
import org.hypertrace.logalert.evaluator.EvaluationResult;
import org.hypertrace.logalert.evaluator.metrics.MetricExtractor;
import org.hypertrace.logalert.evaluator.metrics.MetricsHistory;
import org.hypertrace.logalert.notification.service.DispatchSummary;
import org.hypertrace.logalert.notification.service.Notifier;
import org.hypertrace.logalert.notification.service.NotifierRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates alert rules against batches of log entries and dispatches the alerts that fire.
 *
 * <p>{@link #processLogs} may be called from several threads. One lock guards the rule and
 * notifier collections, the metric history writes and the snapshot of rules to evaluate; it is
 * released before evaluation and notifier dispatch, so slow notifiers never block other calls. A
 * rule fires at most once per cooldown period even under concurrent calls.
 */
public class AlertEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEngine.class);

  static final String RULE_TRIGGERED_COUNTER = "log.alert.engine.rule.triggered";
  static final String RULE_EVALUATION_ERROR_COUNTER = "log.alert.engine.rule.evaluation.error";
  static final String PROCESS_LOGS_TIMER = "log.alert.engine.process.logs.latency";
  private static final String RULE_ID_TAG = "ruleId";

  private final Object lock = new Object();
  // insertion ordered, replacing a rule keeps its position
  private final Map<String, AlertRule> rules = new LinkedHashMap<>();
  private final NotifierRegistry notifierRegistry;
  private final MetricsHistory metricsHistory;
  private final MetricExtractor metricExtractor;
  private final AlertRuleEvaluator alertRuleEvaluator;
  private final Clock clock;

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> ruleTriggeredCounter = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> ruleEvaluationErrorCounter =
      new ConcurrentHashMap<>();
  private final Timer processLogsTimer;

  public AlertEngine() {
    this(AlertEngineConfig.defaults(), Clock.systemUTC(), new SimpleMeterRegistry());
  }

  public AlertEngine(AlertEngineConfig config, Clock clock, MeterRegistry meterRegistry) {
    this(config, new AlertRuleEvaluator(), clock, meterRegistry);
  }

  @VisibleForTesting
  AlertEngine(
      AlertEngineConfig config,
      AlertRuleEvaluator alertRuleEvaluator,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.metricsHistory = new MetricsHistory(config.getHistoryCapacity());
    this.metricExtractor = new MetricExtractor(config.getExtractionPatterns());
    this.alertRuleEvaluator = alertRuleEvaluator;
    this.notifierRegistry = new NotifierRegistry(meterRegistry);
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.processLogsTimer = Timer.builder(PROCESS_LOGS_TIMER).register(meterRegistry);
  }

  /** Adds the rule, replacing in place any rule with the same id. */
  public void addRule(AlertRule rule) {
    Preconditions.checkArgument(rule != null, "alert rule is required");
    AlertRule previous;
    synchronized (lock) {
      previous = rules.put(rule.getId(), rule);
    }
    if (previous != null) {
      LOGGER.info("Updated alert rule {}", rule);
    } else {
      LOGGER.info("Added alert rule {}", rule);
    }
  }

  public boolean removeRule(String ruleId) {
    AlertRule removed;
    synchronized (lock) {
      removed = ruleId == null ? null : rules.remove(ruleId);
    }
    if (removed != null) {
      LOGGER.info("Removed alert rule {}", ruleId);
    }
    return removed != null;
  }

  public Optional<AlertRule> getRule(String ruleId) {
    synchronized (lock) {
      return Optional.ofNullable(rules.get(ruleId));
    }
  }

  /** Snapshot of the rules in evaluation order. */
  public List<AlertRule> getRules() {
    synchronized (lock) {
      return List.copyOf(rules.values());
    }
  }

  /** Registers the notifier, replacing any notifier with the same name. */
  public void addNotifier(Notifier notifier) {
    synchronized (lock) {
      notifierRegistry.addNotifier(notifier);
    }
  }

  public boolean removeNotifier(String name) {
    synchronized (lock) {
      return notifierRegistry.removeNotifier(name);
    }
  }

  public List<String> getNotifierNames() {
    return notifierRegistry.getNotifierNames();
  }

  /**
   * Records the metrics of the batch, evaluates every enabled rule that is not cooling down and
   * dispatches the alerts that fire.
   *
   * @return the fired alerts in rule order; empty for an empty batch
   */
  public List<TriggeredAlert> processLogs(List<LogEntry> logEntries) {
    if (logEntries == null || logEntries.isEmpty()) {
      return List.of();
    }
    Instant startTime = Instant.now();
    Instant now = clock.instant();

    List<AlertRule> rulesToEvaluate;
    synchronized (lock) {
      metricExtractor.recordInto(metricsHistory, logEntries, now);
      rulesToEvaluate =
          rules.values().stream()
              .filter(AlertRule::isEnabled)
              .filter(rule -> !rule.isInCooldown(now))
              .collect(Collectors.toList());
    }
    LOGGER.debug(
        "Evaluating {} rules against {} log entries", rulesToEvaluate.size(), logEntries.size());

    List<TriggeredAlert> triggeredAlerts = new ArrayList<>();
    for (AlertRule rule : rulesToEvaluate) {
      evaluate(rule, logEntries, now).ifPresent(triggeredAlerts::add);
    }

    processLogsTimer.record(
        Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
    return triggeredAlerts;
  }

  private Optional<TriggeredAlert> evaluate(
      AlertRule rule, List<LogEntry> logEntries, Instant now) {
    EvaluationResult result;
    try {
      result = alertRuleEvaluator.process(rule, logEntries, metricsHistory, now);
    } catch (RuntimeException | StackOverflowError e) {
      LOGGER.error("Exception evaluating alert rule {} ({})", rule.getId(), rule.getName(), e);
      increment(ruleEvaluationErrorCounter, RULE_EVALUATION_ERROR_COUNTER, rule.getId());
      return Optional.empty();
    }
    if (!result.isTriggered()) {
      return Optional.empty();
    }
    if (!rule.tryMarkTriggered(now)) {
      LOGGER.debug("Alert rule {} already fired within its cooldown period", rule.getId());
      return Optional.empty();
    }

    LOGGER.info("Alert rule {} ({}) triggered at {}", rule.getId(), rule.getName(), now);
    increment(ruleTriggeredCounter, RULE_TRIGGERED_COUNTER, rule.getId());
    DispatchSummary dispatchSummary = notifierRegistry.dispatch(rule, result.getContext());
    LOGGER.debug("Dispatched alert rule {}: {}", rule.getId(), dispatchSummary);

    return Optional.of(
        TriggeredAlert.builder()
            .rule(rule.getName())
            .severity(rule.getSeverity().getValue())
            .time(now.toString())
            .context(result.getContext())
            .build());
  }

  private void increment(ConcurrentMap<String, Counter> counters, String name, String ruleId) {
    counters
        .computeIfAbsent(
            ruleId, k -> Counter.builder(name).tag(RULE_ID_TAG, k).register(meterRegistry))
        .increment();
  }

  @VisibleForTesting
  MetricsHistory getMetricsHistory() {
    return metricsHistory;
  }
}
