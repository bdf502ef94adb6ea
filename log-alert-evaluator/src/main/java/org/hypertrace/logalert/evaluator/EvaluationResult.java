package org.hypertrace.logalert.evaluator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class EvaluationResult {
  private final boolean triggered;
  private final Map<String, Object> context;

  @Builder
  private EvaluationResult(boolean triggered, Map<String, Object> context) {
    this.triggered = triggered;
    this.context =
        context == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  static EvaluationResult notTriggered(Map<String, Object> context) {
    return EvaluationResult.builder().triggered(false).context(context).build();
  }

  static EvaluationResult of(boolean triggered, Map<String, Object> context) {
    return EvaluationResult.builder().triggered(triggered).context(context).build();
  }
}
