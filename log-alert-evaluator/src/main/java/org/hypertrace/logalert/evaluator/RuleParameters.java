package org.hypertrace.logalert.evaluator;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.LogLevel;

/**
 * Typed view over the loosely typed parameters of a rule. Numeric parameters may be given as
 * numbers or numeric strings; anything else raises {@link InvalidRuleParameterException}.
 */
class RuleParameters {
  private final String ruleId;
  private final Map<String, Object> parameters;

  RuleParameters(AlertRule rule) {
    this.ruleId = rule.getId();
    this.parameters = rule.getParameters();
  }

  Optional<String> getString(String key) {
    Object value = parameters.get(key);
    if (value == null) {
      return Optional.empty();
    }
    String stringValue = value.toString();
    return StringUtils.isEmpty(stringValue) ? Optional.empty() : Optional.of(stringValue);
  }

  String requireString(String key) {
    return getString(key).orElseThrow(() -> missing(key));
  }

  /** The parameter as configured, for reporting back in the alert context. */
  Optional<Object> getRaw(String key) {
    return Optional.ofNullable(parameters.get(key));
  }

  Optional<Double> getDouble(String key) {
    Object value = parameters.get(key);
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Number) {
      return Optional.of(((Number) value).doubleValue());
    }
    if (value instanceof String) {
      try {
        return Optional.of(Double.parseDouble(((String) value).trim()));
      } catch (NumberFormatException e) {
        throw new InvalidRuleParameterException(
            String.format("Parameter %s of rule %s is not numeric: %s", key, ruleId, value), e);
      }
    }
    throw new InvalidRuleParameterException(
        String.format("Parameter %s of rule %s is not numeric: %s", key, ruleId, value));
  }

  double getDouble(String key, double defaultValue) {
    return getDouble(key).orElse(defaultValue);
  }

  double requireDouble(String key) {
    return getDouble(key).orElseThrow(() -> missing(key));
  }

  int getInt(String key, int defaultValue) {
    return getDouble(key).map(Double::intValue).orElse(defaultValue);
  }

  /** Windows are configured in seconds, fractions allowed. */
  Duration getWindow(String key, long defaultSeconds) {
    double seconds = getDouble(key, defaultSeconds);
    if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds < 0) {
      throw new InvalidRuleParameterException(
          String.format("Parameter %s of rule %s is not a valid window: %s", key, ruleId, seconds));
    }
    return Duration.ofMillis(Math.round(seconds * 1000));
  }

  Optional<LogLevel> getLevel(String key) {
    Optional<String> level = getString(key);
    if (level.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LogLevel.fromString(level.get()));
    } catch (IllegalArgumentException e) {
      throw new InvalidRuleParameterException(
          String.format("Parameter %s of rule %s is not a log level: %s", key, ruleId, level.get()),
          e);
    }
  }

  private InvalidRuleParameterException missing(String key) {
    return new InvalidRuleParameterException(
        String.format("Rule %s is missing required parameter %s", ruleId, key));
  }
}
