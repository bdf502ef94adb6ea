package org.hypertrace.logalert.notification.service;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** Notifier names of one dispatch, split by outcome. */
@Builder
@Getter
@ToString
public class DispatchSummary {
  @Singular("delivered")
  private final List<String> delivered;

  @Singular("failed")
  private final List<String> failed;

  @Singular("missing")
  private final List<String> missing;

  public boolean isAllDelivered() {
    return failed.isEmpty() && missing.isEmpty();
  }
}
