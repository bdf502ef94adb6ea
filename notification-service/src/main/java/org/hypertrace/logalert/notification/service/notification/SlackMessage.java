package org.hypertrace.logalert.notification.service.notification;

import com.google.common.base.Strings;
import java.time.Instant;
import java.util.List;
import org.hypertrace.logalert.notification.transport.webhook.slack.SectionBlock;
import org.hypertrace.logalert.notification.transport.webhook.slack.Text;

public interface SlackMessage {

  static SectionBlock getTitleBlock(String titleMessage) {
    SectionBlock titleBlock = new SectionBlock();
    titleBlock.setText(Text.markdown(titleMessage));
    return titleBlock;
  }

  static void addIfNotEmpty(List<Text> metadataFields, String value, String type) {
    if (!Strings.isNullOrEmpty(value)) {
      metadataFields.add(Text.markdown("*" + type + ":*\n" + value));
    }
  }

  // Slack renders <!date^...> in the reader's time zone and falls back to the UTC text
  static void addTimestamp(List<Text> metadataFields, Instant value, String type) {
    if (value != null) {
      metadataFields.add(
          Text.markdown(
              "*"
                  + type
                  + ":*\n"
                  + "<!date^"
                  + value.getEpochSecond()
                  + "^"
                  + "{date_num} {time_secs}|"
                  + value
                  + " UTC>"));
    }
  }
}
