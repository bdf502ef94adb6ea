package org.hypertrace.logalert.engine;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.util.List;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.rule.source.RuleSource;
import org.hypertrace.logalert.datamodel.rule.source.RuleSourceProvider;
import org.hypertrace.logalert.notification.service.Notifier;
import org.hypertrace.logalert.notification.service.NotifiersReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds an {@link AlertEngine} with the rules and notifiers named in configuration. */
public class AlertEngineFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEngineFactory.class);
  static final String ALERT_RULE_SOURCE = "alertRuleSource";

  public static AlertEngine create(Config config) throws IOException {
    return create(config, Clock.systemUTC(), new SimpleMeterRegistry());
  }

  public static AlertEngine create(Config config, Clock clock, MeterRegistry meterRegistry)
      throws IOException {
    AlertEngineConfig alertEngineConfig = AlertEngineConfig.from(config);
    LOGGER.info("Creating alert engine with {}", alertEngineConfig);
    AlertEngine alertEngine = new AlertEngine(alertEngineConfig, clock, meterRegistry);

    for (Notifier notifier : NotifiersReader.read(config)) {
      alertEngine.addNotifier(notifier);
    }
    if (config.hasPath(ALERT_RULE_SOURCE)) {
      RuleSource ruleSource = RuleSourceProvider.getProvider(config.getConfig(ALERT_RULE_SOURCE));
      List<AlertRule> rules = ruleSource.getAllRules(ruleNode -> true);
      for (AlertRule rule : rules) {
        alertEngine.addRule(rule);
      }
    }
    return alertEngine;
  }
}
