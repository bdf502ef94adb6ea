package org.hypertrace.logalert.evaluator.metrics;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.hypertrace.logalert.datamodel.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the per-batch metrics: {@code error_rate}, {@code log_frequency} and whatever the
 * extraction patterns find in the messages. When several messages of a batch match one pattern
 * the last match wins.
 */
public class MetricExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricExtractor.class);

  public static final String ERROR_RATE = "error_rate";
  public static final String LOG_FREQUENCY = "log_frequency";
  public static final String API_LATENCY = "api_latency";
  public static final String DB_QUERY_TIME = "db_query_time";

  public static final List<MetricExtractionPattern> DEFAULT_EXTRACTION_PATTERNS =
      List.of(
          new MetricExtractionPattern(API_LATENCY, "API request completed in (\\d+\\.?\\d*) ms"),
          new MetricExtractionPattern(DB_QUERY_TIME, "Database query took (\\d+\\.?\\d*) ms"));

  private final List<MetricExtractionPattern> extractionPatterns;

  public MetricExtractor() {
    this(DEFAULT_EXTRACTION_PATTERNS);
  }

  public MetricExtractor(List<MetricExtractionPattern> extractionPatterns) {
    this.extractionPatterns = List.copyOf(extractionPatterns);
  }

  public Map<String, Double> extract(List<LogEntry> logEntries) {
    Map<String, Double> metrics = new LinkedHashMap<>();
    if (logEntries.isEmpty()) {
      return metrics;
    }

    long errorCount =
        logEntries.stream()
            .filter(logEntry -> logEntry.getLevel() != null && logEntry.getLevel().isErrorOrAbove())
            .count();
    metrics.put(ERROR_RATE, (double) errorCount / logEntries.size());
    metrics.put(LOG_FREQUENCY, (double) logEntries.size());

    for (LogEntry logEntry : logEntries) {
      for (MetricExtractionPattern extractionPattern : extractionPatterns) {
        OptionalDouble value = extractionPattern.extract(logEntry.getMessage());
        if (value.isPresent()) {
          metrics.put(extractionPattern.getMetricName(), value.getAsDouble());
        }
      }
    }
    return metrics;
  }

  /**
   * Extracts the batch metrics and records them with one shared timestamp: the first entry's
   * timestamp, or {@code now} when it has none.
   */
  public Map<String, Double> recordInto(
      MetricsHistory metricsHistory, List<LogEntry> logEntries, Instant now) {
    Map<String, Double> metrics = extract(logEntries);
    if (metrics.isEmpty()) {
      return metrics;
    }
    Instant timestamp = logEntries.get(0).getTimestampOrDefault(now);
    metrics.forEach((metricName, value) -> metricsHistory.record(metricName, timestamp, value));
    LOGGER.debug("Recorded batch metrics {} at {}", metrics, timestamp);
    return metrics;
  }
}
