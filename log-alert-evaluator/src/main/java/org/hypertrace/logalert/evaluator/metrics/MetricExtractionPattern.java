package org.hypertrace.logalert.evaluator.metrics;

import com.google.common.base.Preconditions;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps a numeric value found in a log message to a named metric. */
@Getter
public class MetricExtractionPattern {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricExtractionPattern.class);

  private final String metricName;
  private final Pattern pattern;

  public MetricExtractionPattern(String metricName, String regex) {
    Preconditions.checkArgument(metricName != null && !metricName.isEmpty());
    this.metricName = metricName;
    this.pattern = Pattern.compile(regex);
    Preconditions.checkArgument(
        pattern.matcher("").groupCount() >= 1,
        "extraction pattern for %s needs a capturing group",
        metricName);
  }

  OptionalDouble extract(String message) {
    Matcher matcher = pattern.matcher(message);
    if (!matcher.find()) {
      return OptionalDouble.empty();
    }
    String value = matcher.group(1);
    if (value == null) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(value));
    } catch (NumberFormatException e) {
      LOGGER.debug("Ignoring non numeric value {} for metric {}", value, metricName);
      return OptionalDouble.empty();
    }
  }
}
