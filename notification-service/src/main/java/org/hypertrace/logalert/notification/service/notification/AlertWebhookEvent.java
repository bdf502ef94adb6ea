package org.hypertrace.logalert.notification.service.notification;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/** JSON body posted to webhooks: {@code {"alert": {...}, "context": {...}}}. */
@Builder
@Getter
class AlertWebhookEvent {
  private final Alert alert;
  private final Map<String, Object> context;

  @Builder
  @Getter
  static class Alert {
    private final String name;
    private final String description;
    private final String severity;
    private final String time;
  }
}
