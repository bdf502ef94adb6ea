package org.hypertrace.logalert.notification.service.notification;

import java.util.Locale;

public enum WebhookFormat {
  JSON,
  SLACK;

  public static WebhookFormat fromValue(String value) {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(String.format("Invalid webhook format:%s", value), e);
    }
  }
}
