package org.hypertrace.logalert.datamodel;

import com.google.common.base.Preconditions;
import java.util.Locale;

public enum LogLevel {
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  private static final String WARN_ALIAS = "WARN";

  /** Case-insensitive lookup. {@code WARN} is accepted as an alias of {@link #WARNING}. */
  public static LogLevel fromString(String level) {
    Preconditions.checkArgument(level != null, "log level can not be null");
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    if (WARN_ALIAS.equals(normalized)) {
      return WARNING;
    }
    try {
      return LogLevel.valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(String.format("Unknown log level:%s", level), e);
    }
  }

  public boolean isErrorOrAbove() {
    return this == ERROR || this == CRITICAL;
  }
}
