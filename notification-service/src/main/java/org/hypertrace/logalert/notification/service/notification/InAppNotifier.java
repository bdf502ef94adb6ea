package org.hypertrace.logalert.notification.service.notification;

import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.function.BiConsumer;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.notification.service.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands alerts to an in-process callback, for example a UI event bus. */
public class InAppNotifier implements Notifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(InAppNotifier.class);
  public static final String DEFAULT_NAME = "in-app";

  private final String name;
  private final BiConsumer<AlertRule, Map<String, Object>> callback;

  public InAppNotifier(BiConsumer<AlertRule, Map<String, Object>> callback) {
    this(DEFAULT_NAME, callback);
  }

  public InAppNotifier(String name, BiConsumer<AlertRule, Map<String, Object>> callback) {
    Preconditions.checkArgument(callback != null, "callback is required");
    this.name = name;
    this.callback = callback;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean send(AlertRule rule, Map<String, Object> context) {
    try {
      callback.accept(rule, context);
      return true;
    } catch (RuntimeException e) {
      LOGGER.error("In-app callback {} failed for rule {}", name, rule.getId(), e);
      return false;
    }
  }
}
