package org.hypertrace.logalert.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.typesafe.config.ConfigFactory;
import org.hypertrace.logalert.evaluator.metrics.MetricExtractor;
import org.junit.jupiter.api.Test;

class AlertEngineConfigTest {

  @Test
  void testReferenceDefaults() {
    AlertEngineConfig config = AlertEngineConfig.defaults();

    assertEquals(1000, config.getHistoryCapacity());
    assertEquals(2, config.getExtractionPatterns().size());
    assertEquals(
        MetricExtractor.API_LATENCY, config.getExtractionPatterns().get(0).getMetricName());
    assertEquals(
        "API request completed in (\\d+\\.?\\d*) ms",
        config.getExtractionPatterns().get(0).getPattern().pattern());
  }

  @Test
  void testOverrides() {
    AlertEngineConfig config =
        AlertEngineConfig.from(
            ConfigFactory.parseString(
                String.join(
                    "\n",
                    "alert.engine.metrics.history.capacity = 10",
                    "alert.engine.metrics.extraction = [",
                    "  { metric = queue_depth, pattern = \"queue depth=(\\\\d+)\" }",
                    "]")));

    assertEquals(10, config.getHistoryCapacity());
    assertEquals("queue_depth", config.getExtractionPatterns().get(0).getMetricName());
    assertEquals(
        "queue depth=(\\d+)", config.getExtractionPatterns().get(0).getPattern().pattern());
  }
}
