package org.hypertrace.logalert.datamodel;

import java.util.Locale;

public enum AlertCondition {
  PATTERN("pattern"),
  THRESHOLD("threshold"),
  ANOMALY("anomaly"),
  FREQUENCY("frequency"),
  ABSENCE("absence");

  private final String value;

  AlertCondition(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static AlertCondition fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AlertCondition condition : values()) {
        if (condition.value.equals(normalized)) {
          return condition;
        }
      }
    }
    throw new IllegalArgumentException(String.format("Unknown alert condition:%s", value));
  }
}
