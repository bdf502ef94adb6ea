package org.hypertrace.logalert.datamodel;

import java.util.Locale;

public enum AlertSeverity {
  INFO("info"),
  WARNING("warning"),
  ERROR("error"),
  CRITICAL("critical");

  private final String value;

  AlertSeverity(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static AlertSeverity fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AlertSeverity severity : values()) {
        if (severity.value.equals(normalized)) {
          return severity;
        }
      }
    }
    throw new IllegalArgumentException(String.format("Unknown alert severity:%s", value));
  }
}
