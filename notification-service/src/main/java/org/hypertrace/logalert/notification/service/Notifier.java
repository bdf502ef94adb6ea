package org.hypertrace.logalert.notification.service;

import java.util.Map;
import org.hypertrace.logalert.datamodel.AlertRule;

/** A destination for triggered alerts, identified by a unique name. */
public interface Notifier {
  String getName();

  /**
   * Delivers the alert on a best-effort basis.
   *
   * @return whether delivery succeeded
   */
  boolean send(AlertRule rule, Map<String, Object> context);
}
