package org.hypertrace.logalert.notification.transport.webhook.slack;

/** A Slack layout block, serialized with its lower case type name. */
public interface Block {
  String getType();
}
