package org.hypertrace.logalert.datamodel.rule.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.AlertSeverity;
import org.junit.jupiter.api.Test;

class FSRuleSourceTest {

  @Test
  void testReadAllRules() throws Exception {
    RuleSource ruleSource = RuleSourceProvider.getProvider(ruleSourceConfig());

    List<AlertRule> rules = ruleSource.getAllRules(jsonNode -> true);

    assertEquals(3, rules.size());

    AlertRule errorBurst = rules.get(0);
    assertEquals("error-burst", errorBurst.getId());
    assertEquals(AlertCondition.PATTERN, errorBurst.getCondition());
    assertEquals(AlertSeverity.ERROR, errorBurst.getSeverity());
    assertEquals(Map.of("pattern", "ERROR|Exception", "min_matches", 3), errorBurst.getParameters());
    assertEquals(List.of("webhook", "email"), List.copyOf(errorBurst.getNotifierNames()));
    assertEquals(Duration.ofSeconds(120), errorBurst.getCooldownPeriod());

    AlertRule highErrorRate = rules.get(1);
    assertEquals("high_error_rate", highErrorRate.getId());
    assertEquals(0.05, highErrorRate.getParameters().get("threshold"));
    assertTrue(highErrorRate.isEnabled());

    assertFalse(rules.get(2).isEnabled());
  }

  @Test
  void testPredicateFiltersRules() throws Exception {
    RuleSource ruleSource = RuleSourceProvider.getProvider(ruleSourceConfig());

    List<AlertRule> rules =
        ruleSource.getAllRules(jsonNode -> "absence".equals(jsonNode.get("condition").asText()));

    assertEquals(1, rules.size());
    assertEquals("missing_heartbeat", rules.get(0).getId());
  }

  @Test
  void testInvalidRuleSourceType() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RuleSourceProvider.getProvider(ConfigFactory.parseMap(Map.of("type", "dataStore"))));
  }

  @Test
  void testInvalidRuleDocument() {
    AlertRuleReader alertRuleReader = new AlertRuleReader();
    assertThrows(
        IllegalArgumentException.class,
        () ->
            alertRuleReader.read(
                new ObjectMapper().readTree("{\"name\": \"no condition\"}")));
  }

  private static Config ruleSourceConfig() throws Exception {
    String path =
        new File(
                Thread.currentThread().getContextClassLoader().getResource("rules.json").toURI())
            .getAbsolutePath();
    return ConfigFactory.parseMap(Map.of("type", "fs", "fs", Map.of("path", path)));
  }
}
