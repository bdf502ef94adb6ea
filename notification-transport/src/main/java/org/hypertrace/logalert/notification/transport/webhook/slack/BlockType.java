package org.hypertrace.logalert.notification.transport.webhook.slack;

public enum BlockType {
  SECTION,
  CONTEXT
}
