package org.hypertrace.logalert.notification.transport.email;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

@Builder
@Getter
@ToString(exclude = "htmlBody")
public class EmailMessage {
  private final String from;
  @Singular("to")
  private final List<String> to;
  private final String subject;
  private final String htmlBody;
}
