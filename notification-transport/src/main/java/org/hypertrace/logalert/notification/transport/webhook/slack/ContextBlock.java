package org.hypertrace.logalert.notification.transport.webhook.slack;

import java.util.List;

/** Small print shown under a message, such as where the alert came from. */
public class ContextBlock implements Block {
  public static final String TYPE = BlockType.CONTEXT.name().toLowerCase();
  private List<Text> elements;

  @Override
  public String getType() {
    return TYPE;
  }

  public List<Text> getElements() {
    return elements;
  }

  public void setElements(List<Text> elements) {
    this.elements = elements;
  }
}
