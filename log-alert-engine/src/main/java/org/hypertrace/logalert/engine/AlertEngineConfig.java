package org.hypertrace.logalert.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;
import org.hypertrace.logalert.evaluator.metrics.MetricExtractionPattern;

@Getter
@ToString
public class AlertEngineConfig {
  static final String ALERT_ENGINE_CONFIG = "alert.engine";
  private static final String HISTORY_CAPACITY = "metrics.history.capacity";
  private static final String EXTRACTION_PATTERNS = "metrics.extraction";
  private static final String EXTRACTION_METRIC = "metric";
  private static final String EXTRACTION_PATTERN = "pattern";

  private final int historyCapacity;
  private final List<MetricExtractionPattern> extractionPatterns;

  /** Reads {@code alert.engine}, falling back to the bundled reference configuration. */
  public static AlertEngineConfig from(Config config) {
    return new AlertEngineConfig(
        config
            .withFallback(ConfigFactory.defaultReference())
            .resolve()
            .getConfig(ALERT_ENGINE_CONFIG));
  }

  public static AlertEngineConfig defaults() {
    return from(ConfigFactory.empty());
  }

  private AlertEngineConfig(Config engineConfig) {
    this.historyCapacity = engineConfig.getInt(HISTORY_CAPACITY);
    this.extractionPatterns =
        engineConfig.getConfigList(EXTRACTION_PATTERNS).stream()
            .map(
                patternConfig ->
                    new MetricExtractionPattern(
                        patternConfig.getString(EXTRACTION_METRIC),
                        patternConfig.getString(EXTRACTION_PATTERN)))
            .collect(Collectors.toUnmodifiableList());
  }
}
