package org.hypertrace.logalert.notification.service;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.hypertrace.logalert.notification.service.notification.EmailNotifier;
import org.hypertrace.logalert.notification.service.notification.WebhookFormat;
import org.hypertrace.logalert.notification.service.notification.WebhookNotifier;
import org.hypertrace.logalert.notification.transport.email.SmtpEmailSender;
import org.hypertrace.logalert.notification.transport.email.SmtpSettings;
import org.hypertrace.logalert.notification.transport.webhook.WebhookSender;
import org.hypertrace.logalert.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds notifiers from the {@code notifiers} configuration list. In-app notifiers carry a
 * callback and are registered in code instead.
 */
public class NotifiersReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotifiersReader.class);

  public static final String NOTIFIERS = "notifiers";
  private static final String NAME = "name";
  private static final String TYPE = "type";
  static final String TYPE_WEBHOOK = "webhook";
  static final String TYPE_EMAIL = "email";
  private static final String WEBHOOK_URL = "url";
  private static final String WEBHOOK_HEADERS = "headers";
  private static final String WEBHOOK_FORMAT = "format";
  private static final String WEBHOOK_TIMEOUT = "timeout";
  private static final String SMTP = "smtp";
  private static final String SMTP_HOST = "host";
  private static final String SMTP_PORT = "port";
  private static final String SMTP_USERNAME = "username";
  private static final String SMTP_PASSWORD = "password";
  private static final String SMTP_TLS = "tls";
  private static final String EMAIL_FROM = "from";
  private static final String EMAIL_TO = "to";

  public static List<Notifier> read(Config config) {
    List<Notifier> notifiers = new ArrayList<>();
    if (!config.hasPath(NOTIFIERS)) {
      return notifiers;
    }
    for (Config notifierConfig : config.getConfigList(NOTIFIERS)) {
      String type = notifierConfig.getString(TYPE);
      switch (type) {
        case TYPE_WEBHOOK:
          notifiers.add(readWebhookNotifier(notifierConfig));
          break;
        case TYPE_EMAIL:
          notifiers.add(readEmailNotifier(notifierConfig));
          break;
        default:
          throw new IllegalArgumentException(String.format("Invalid notifier type:%s", type));
      }
      LOGGER.info("Read {} notifier {}", type, notifierConfig.getString(NAME));
    }
    return notifiers;
  }

  private static WebhookNotifier readWebhookNotifier(Config notifierConfig) {
    Duration timeout =
        notifierConfig.hasPath(WEBHOOK_TIMEOUT)
            ? notifierConfig.getDuration(WEBHOOK_TIMEOUT)
            : HttpWithJsonSender.DEFAULT_TIMEOUT;
    HttpWithJsonSender httpWithJsonSender =
        timeout.equals(HttpWithJsonSender.DEFAULT_TIMEOUT)
            ? HttpWithJsonSender.getInstance()
            : new HttpWithJsonSender(timeout);

    return WebhookNotifier.builder()
        .name(notifierConfig.getString(NAME))
        .url(notifierConfig.getString(WEBHOOK_URL))
        .headers(readHeaders(notifierConfig))
        .format(
            notifierConfig.hasPath(WEBHOOK_FORMAT)
                ? WebhookFormat.fromValue(notifierConfig.getString(WEBHOOK_FORMAT))
                : WebhookFormat.JSON)
        .webhookSender(new WebhookSender(httpWithJsonSender))
        .build();
  }

  private static Map<String, String> readHeaders(Config notifierConfig) {
    Map<String, String> headers = new LinkedHashMap<>();
    if (notifierConfig.hasPath(WEBHOOK_HEADERS)) {
      notifierConfig
          .getConfig(WEBHOOK_HEADERS)
          .root()
          .unwrapped()
          .forEach((key, value) -> headers.put(key, String.valueOf(value)));
    }
    return headers;
  }

  private static EmailNotifier readEmailNotifier(Config notifierConfig) {
    Config smtpConfig = notifierConfig.getConfig(SMTP);
    SmtpSettings.SmtpSettingsBuilder smtpSettings =
        SmtpSettings.builder().host(smtpConfig.getString(SMTP_HOST));
    if (smtpConfig.hasPath(SMTP_PORT)) {
      smtpSettings.port(smtpConfig.getInt(SMTP_PORT));
    }
    if (smtpConfig.hasPath(SMTP_USERNAME)) {
      smtpSettings.username(smtpConfig.getString(SMTP_USERNAME));
    }
    if (smtpConfig.hasPath(SMTP_PASSWORD)) {
      smtpSettings.password(smtpConfig.getString(SMTP_PASSWORD));
    }
    if (smtpConfig.hasPath(SMTP_TLS)) {
      smtpSettings.startTls(smtpConfig.getBoolean(SMTP_TLS));
    }

    return EmailNotifier.builder()
        .name(notifierConfig.getString(NAME))
        .from(notifierConfig.getString(EMAIL_FROM))
        .to(notifierConfig.getStringList(EMAIL_TO))
        .emailSender(new SmtpEmailSender(smtpSettings.build()))
        .build();
  }
}
