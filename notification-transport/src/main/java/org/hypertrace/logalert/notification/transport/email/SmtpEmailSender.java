package org.hypertrace.logalert.notification.transport.email;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends HTML mail through an SMTP relay, upgrading to STARTTLS when configured. */
public class SmtpEmailSender implements EmailSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(SmtpEmailSender.class);

  private final SmtpSettings settings;
  private final Session session;

  public SmtpEmailSender(SmtpSettings settings) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(settings.getHost()), "smtp host is required");
    this.settings = settings;
    this.session = createSession(settings);
  }

  @Override
  public boolean send(EmailMessage message) {
    try {
      Transport.send(createMessage(message));
      LOGGER.debug("Sent email {} via {}", message, settings.getHost());
      return true;
    } catch (MessagingException e) {
      LOGGER.error(
          "Failed to send email {} via {}:{}", message, settings.getHost(), settings.getPort(), e);
      return false;
    }
  }

  @VisibleForTesting
  MimeMessage createMessage(EmailMessage message) throws MessagingException {
    Preconditions.checkArgument(!message.getTo().isEmpty(), "email needs at least one recipient");
    MimeMessage mimeMessage = new MimeMessage(session);
    mimeMessage.setFrom(new InternetAddress(message.getFrom()));
    mimeMessage.setRecipients(
        Message.RecipientType.TO, InternetAddress.parse(String.join(",", message.getTo())));
    mimeMessage.setSubject(message.getSubject(), StandardCharsets.UTF_8.name());
    mimeMessage.setContent(message.getHtmlBody(), "text/html; charset=utf-8");
    mimeMessage.setSentDate(new Date());
    return mimeMessage;
  }

  private static Session createSession(SmtpSettings settings) {
    String timeoutMillis = String.valueOf(settings.getTimeout().toMillis());
    Properties properties = new Properties();
    properties.put("mail.smtp.host", settings.getHost());
    properties.put("mail.smtp.port", String.valueOf(settings.getPort()));
    properties.put("mail.smtp.starttls.enable", String.valueOf(settings.isStartTls()));
    properties.put("mail.smtp.connectiontimeout", timeoutMillis);
    properties.put("mail.smtp.timeout", timeoutMillis);
    properties.put("mail.smtp.writetimeout", timeoutMillis);

    if (Strings.isNullOrEmpty(settings.getUsername())) {
      return Session.getInstance(properties);
    }
    properties.put("mail.smtp.auth", "true");
    return Session.getInstance(
        properties,
        new Authenticator() {
          @Override
          protected PasswordAuthentication getPasswordAuthentication() {
            return new PasswordAuthentication(settings.getUsername(), settings.getPassword());
          }
        });
  }
}
