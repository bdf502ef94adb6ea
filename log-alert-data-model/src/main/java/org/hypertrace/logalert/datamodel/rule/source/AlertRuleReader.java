package org.hypertrace.logalert.datamodel.rule.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.AlertSeverity;

/** Converts a JSON rule document into an {@link AlertRule}. */
public class AlertRuleReader {
  static final String ID = "id";
  static final String NAME = "name";
  static final String DESCRIPTION = "description";
  static final String CONDITION = "condition";
  static final String PARAMETERS = "parameters";
  static final String SEVERITY = "severity";
  static final String NOTIFIERS = "notifiers";
  static final String ENABLED = "enabled";
  static final String COOLDOWN_PERIOD = "cooldown_period";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE =
      new TypeReference<>() {};

  public AlertRule read(JsonNode rule) {
    if (rule == null || !rule.isObject()) {
      throw new IllegalArgumentException(
          String.format("Alert rule should be a json object:%s", rule));
    }
    if (!hasText(rule, NAME)) {
      throw new IllegalArgumentException(String.format("Alert rule without name:%s", rule));
    }
    if (!hasText(rule, CONDITION)) {
      throw new IllegalArgumentException(String.format("Alert rule without condition:%s", rule));
    }

    AlertRule.AlertRuleBuilder builder =
        AlertRule.builder()
            .name(rule.get(NAME).asText())
            .condition(AlertCondition.fromValue(rule.get(CONDITION).asText()));

    if (hasText(rule, ID)) {
      builder.id(rule.get(ID).asText());
    }
    if (hasText(rule, DESCRIPTION)) {
      builder.description(rule.get(DESCRIPTION).asText());
    }
    if (hasText(rule, SEVERITY)) {
      builder.severity(AlertSeverity.fromValue(rule.get(SEVERITY).asText()));
    }
    if (rule.hasNonNull(PARAMETERS)) {
      builder.parameters(OBJECT_MAPPER.convertValue(rule.get(PARAMETERS), PARAMETERS_TYPE));
    }
    if (rule.hasNonNull(NOTIFIERS)) {
      List<String> notifierNames = new ArrayList<>();
      rule.get(NOTIFIERS).forEach(notifier -> notifierNames.add(notifier.asText()));
      builder.notifierNames(notifierNames);
    }
    if (rule.hasNonNull(ENABLED)) {
      builder.enabled(rule.get(ENABLED).asBoolean());
    }
    if (rule.hasNonNull(COOLDOWN_PERIOD)) {
      builder.cooldownPeriod(Duration.ofSeconds(rule.get(COOLDOWN_PERIOD).asLong()));
    }
    return builder.build();
  }

  private static boolean hasText(JsonNode node, String field) {
    return node.hasNonNull(field) && !node.get(field).asText().isEmpty();
  }
}
