package org.hypertrace.logalert.notification.service.notification;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.notification.service.Notifier;
import org.hypertrace.logalert.notification.transport.webhook.WebhookSender;

/** Posts alerts to a webhook, either as the plain JSON event or as a Slack attachment. */
public class WebhookNotifier implements Notifier {

  @Getter private final String name;
  @Getter private final String url;
  private final Map<String, String> headers;
  @Getter private final WebhookFormat format;
  private final WebhookSender webhookSender;
  private final Clock clock;

  @Builder
  private WebhookNotifier(
      String name,
      String url,
      Map<String, String> headers,
      WebhookFormat format,
      WebhookSender webhookSender,
      Clock clock) {
    Preconditions.checkArgument(url != null, "webhook url is required");
    Preconditions.checkArgument(webhookSender != null, "webhook sender is required");
    this.name = name == null ? "webhook" : name;
    this.url = url;
    this.headers = headers == null ? Map.of() : Map.copyOf(headers);
    this.format = format == null ? WebhookFormat.JSON : format;
    this.webhookSender = webhookSender;
    this.clock = clock == null ? Clock.systemUTC() : clock;
  }

  @Override
  public boolean send(AlertRule rule, Map<String, Object> context) {
    AlertWebhookEvent event = convert(rule, context);
    if (format == WebhookFormat.SLACK) {
      return webhookSender.send(url, headers, AlertSlackEvent.getMessage(event));
    }
    return webhookSender.send(url, headers, event);
  }

  private AlertWebhookEvent convert(AlertRule rule, Map<String, Object> context) {
    return AlertWebhookEvent.builder()
        .alert(
            AlertWebhookEvent.Alert.builder()
                .name(rule.getName())
                .description(rule.getDescription())
                .severity(rule.getSeverity().getValue())
                .time(clock.instant().toString())
                .build())
        .context(context)
        .build();
  }
}
