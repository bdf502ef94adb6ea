package org.hypertrace.logalert.notification.service.notification;

import static org.hypertrace.logalert.notification.service.notification.SlackMessage.addIfNotEmpty;
import static org.hypertrace.logalert.notification.service.notification.SlackMessage.addTimestamp;
import static org.hypertrace.logalert.notification.service.notification.SlackMessage.getTitleBlock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.logalert.datamodel.AlertSeverity;
import org.hypertrace.logalert.notification.transport.webhook.slack.Attachment;
import org.hypertrace.logalert.notification.transport.webhook.slack.ContextBlock;
import org.hypertrace.logalert.notification.transport.webhook.slack.SectionBlock;
import org.hypertrace.logalert.notification.transport.webhook.slack.Text;

public class AlertSlackEvent implements SlackMessage {

  public static final String SEVERITY = "Severity";
  public static final String TRIGGERED_AT = "Triggered At";
  public static final String DESCRIPTION = "Description";
  public static final String DETAILS = "Details";
  static final String FOOTER = "Sent by the log alert engine";
  private final List<Attachment> attachments;

  public AlertSlackEvent(List<Attachment> attachments) {
    this.attachments = attachments;
  }

  static AlertSlackEvent getMessage(AlertWebhookEvent alertWebhookEvent) {
    AlertWebhookEvent.Alert alert = alertWebhookEvent.getAlert();
    SectionBlock titleBlock =
        getTitleBlock("*[" + alert.getSeverity().toUpperCase() + "] " + alert.getName() + "*");

    List<Text> metadataFields = new ArrayList<>();
    addIfNotEmpty(metadataFields, alert.getSeverity(), SEVERITY);
    addTimestamp(metadataFields, Instant.parse(alert.getTime()), TRIGGERED_AT);
    addIfNotEmpty(metadataFields, alert.getDescription(), DESCRIPTION);
    addIfNotEmpty(metadataFields, getDetails(alertWebhookEvent.getContext()), DETAILS);

    SectionBlock metadataBlock = new SectionBlock();
    metadataBlock.setFields(metadataFields);

    ContextBlock footerBlock = new ContextBlock();
    footerBlock.setElements(List.of(Text.markdown(FOOTER)));

    Attachment attachment = new Attachment();
    attachment.setColor(getColor(alert.getSeverity()));
    attachment.setBlocks(List.of(titleBlock, metadataBlock, footerBlock));
    return new AlertSlackEvent(List.of(attachment));
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }

  // nested values such as matching_logs are left to the json format
  private static String getDetails(Map<String, Object> context) {
    return context.entrySet().stream()
        .filter(entry -> entry.getValue() != null)
        .filter(entry -> !(entry.getValue() instanceof Map))
        .filter(entry -> !(entry.getValue() instanceof Collection))
        .map(entry -> entry.getKey() + ": " + entry.getValue())
        .collect(Collectors.joining("\n"));
  }

  private static String getColor(String severity) {
    switch (AlertSeverity.fromValue(severity)) {
      case CRITICAL:
        return Attachment.RED;
      case ERROR:
        return Attachment.ORANGE;
      case WARNING:
        return Attachment.YELLOW;
      default:
        return Attachment.BLUE;
    }
  }
}
