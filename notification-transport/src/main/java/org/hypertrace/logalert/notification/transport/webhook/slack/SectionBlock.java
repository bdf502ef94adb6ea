package org.hypertrace.logalert.notification.transport.webhook.slack;

import java.util.List;

public class SectionBlock implements Block {
  public static final String TYPE = BlockType.SECTION.name().toLowerCase();
  private Text text;
  private List<Text> fields;

  @Override
  public String getType() {
    return TYPE;
  }

  public Text getText() {
    return text;
  }

  public void setText(Text text) {
    this.text = text;
  }

  public List<Text> getFields() {
    return fields;
  }

  public void setFields(List<Text> fields) {
    this.fields = fields;
  }
}
