package org.hypertrace.logalert.notification.service.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Preconditions;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.notification.service.Notifier;
import org.hypertrace.logalert.notification.transport.email.EmailMessage;
import org.hypertrace.logalert.notification.transport.email.EmailSender;
import org.hypertrace.logalert.notification.transport.webhook.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Mails alerts as HTML with subject {@code [SEVERITY] rule name}. */
public class EmailNotifier implements Notifier {
  private static final Logger LOGGER = LoggerFactory.getLogger(EmailNotifier.class);
  private static final Escaper HTML_ESCAPER = HtmlEscapers.htmlEscaper();

  @Getter private final String name;
  private final String from;
  private final List<String> to;
  private final EmailSender emailSender;
  private final Clock clock;

  @Builder
  private EmailNotifier(
      String name, String from, List<String> to, EmailSender emailSender, Clock clock) {
    Preconditions.checkArgument(from != null, "email sender address is required");
    Preconditions.checkArgument(to != null && !to.isEmpty(), "email recipients are required");
    Preconditions.checkArgument(emailSender != null, "email sender is required");
    this.name = name == null ? "email" : name;
    this.from = from;
    this.to = List.copyOf(to);
    this.emailSender = emailSender;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  @Override
  public boolean send(AlertRule rule, Map<String, Object> context) {
    EmailMessage message =
        EmailMessage.builder()
            .from(from)
            .to(to)
            .subject(getSubject(rule))
            .htmlBody(getHtmlBody(rule, context))
            .build();
    return emailSender.send(message);
  }

  static String getSubject(AlertRule rule) {
    return "[" + rule.getSeverity().getValue().toUpperCase() + "] " + rule.getName();
  }

  String getHtmlBody(AlertRule rule, Map<String, Object> context) {
    return "<html><body>"
        + "<h2>"
        + HTML_ESCAPER.escape(rule.getName())
        + "</h2>"
        + "<p><strong>Description:</strong> "
        + HTML_ESCAPER.escape(rule.getDescription())
        + "</p>"
        + "<p><strong>Severity:</strong> "
        + rule.getSeverity().getValue()
        + "</p>"
        + "<p><strong>Time:</strong> "
        + clock.instant()
        + "</p>"
        + "<h3>Context</h3>"
        + "<pre>"
        + HTML_ESCAPER.escape(prettyPrint(context))
        + "</pre>"
        + "</body></html>";
  }

  private static String prettyPrint(Map<String, Object> context) {
    try {
      return ObjectMapperProvider.get()
          .writerWithDefaultPrettyPrinter()
          .writeValueAsString(context);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Unable to render alert context as json, using toString", e);
      return String.valueOf(context);
    }
  }
}
