package org.hypertrace.logalert.notification.transport.webhook.slack;

import java.util.List;

/** POJO to serialize a Slack attachment; the color paints the bar beside the blocks. */
public class Attachment {
  public static final String RED = "#d41729";
  public static final String ORANGE = "#f2871d";
  public static final String YELLOW = "#f2c744";
  public static final String BLUE = "#2f80ed";
  private String color;
  private List<Block> blocks;

  public String getColor() {
    return color;
  }

  public void setColor(String color) {
    this.color = color;
  }

  public List<Block> getBlocks() {
    return blocks;
  }

  public void setBlocks(List<Block> blocks) {
    this.blocks = blocks;
  }
}
