package org.hypertrace.logalert.datamodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Summary of one rule firing during one batch evaluation. */
@Getter
@ToString
public class TriggeredAlert {
  private final String rule;
  private final String severity;
  // ISO-8601
  private final String time;
  private final Map<String, Object> context;

  @Builder
  private TriggeredAlert(String rule, String severity, String time, Map<String, Object> context) {
    this.rule = rule;
    this.severity = severity;
    this.time = time;
    this.context =
        context == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }
}
