package org.hypertrace.logalert.notification.transport.email;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Connection settings of an SMTP relay. A username turns on authentication. */
@Builder
@Getter
@ToString(exclude = "password")
public class SmtpSettings {
  public static final int DEFAULT_PORT = 587;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final String host;
  @Builder.Default private final int port = DEFAULT_PORT;
  private final String username;
  private final String password;
  @Builder.Default private final boolean startTls = true;
  @Builder.Default private final Duration timeout = DEFAULT_TIMEOUT;
}
