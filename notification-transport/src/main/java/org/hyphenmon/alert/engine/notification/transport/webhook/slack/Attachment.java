package org.hyphenmon.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** POJO to serialize a Slack attachment. */
public class Attachment {
  public static final String RED = "#d41729";
  public static final String ORANGE = "#f2a900";
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
