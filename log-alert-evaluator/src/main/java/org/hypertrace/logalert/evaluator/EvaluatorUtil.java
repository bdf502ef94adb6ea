package org.hypertrace.logalert.evaluator;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.lang3.tuple.Pair;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.hypertrace.logalert.datamodel.LogLevel;

class EvaluatorUtil {
  static final String LOG_COUNT = "log_count";
  static final String FIRST_LOG_TIME = "first_log_time";
  static final String LAST_LOG_TIME = "last_log_time";

  static Map<String, Object> baseContext(List<LogEntry> logEntries) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put(LOG_COUNT, logEntries.size());
    context.put(
        FIRST_LOG_TIME, logEntries.isEmpty() ? null : formatTime(logEntries.get(0).getTimestamp()));
    context.put(
        LAST_LOG_TIME,
        logEntries.isEmpty()
            ? null
            : formatTime(logEntries.get(logEntries.size() - 1).getTimestamp()));
    return context;
  }

  static String formatTime(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  static Map<String, Object> summarize(LogEntry logEntry) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("timestamp", formatTime(logEntry.getTimestamp()));
    summary.put("level", logEntry.getLevel() == null ? null : logEntry.getLevel().name());
    summary.put("message", logEntry.getMessage());
    return summary;
  }

  /** Whole seconds as a long, fractional ones as a double. */
  static Number windowSeconds(Duration window) {
    long millis = window.toMillis();
    if (millis % 1000 == 0) {
      return millis / 1000;
    }
    return millis / 1000.0;
  }

  static double mean(List<Double> values) {
    double sum = 0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.size();
  }

  /** Mean and population standard deviation. */
  static Pair<Double, Double> meanAndStandardDeviation(List<Double> values) {
    double mean = mean(values);
    double squaredDeviations = 0;
    for (double value : values) {
      squaredDeviations += (value - mean) * (value - mean);
    }
    return Pair.of(mean, Math.sqrt(squaredDeviations / values.size()));
  }

  /** Entries with the given level (when present) logged at or after {@code windowStart}. */
  static List<LogEntry> filterByLevelAndWindow(
      List<LogEntry> logEntries, LogLevel level, Instant windowStart, Instant now) {
    Predicate<LogEntry> inWindow =
        logEntry -> !logEntry.getTimestampOrDefault(now).isBefore(windowStart);
    return logEntries.stream()
        .filter(logEntry -> level == null || level == logEntry.getLevel())
        .filter(inWindow)
        .collect(Collectors.toList());
  }

  static List<LogEntry> filterByPattern(List<LogEntry> logEntries, Pattern pattern) {
    return logEntries.stream()
        .filter(logEntry -> pattern.matcher(logEntry.getMessage()).find())
        .collect(Collectors.toList());
  }
}
