package org.hypertrace.logalert.notification.transport.email;

public interface EmailSender {
  /** Returns whether the message was handed to the mail server. */
  boolean send(EmailMessage message);
}
