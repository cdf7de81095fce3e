package org.hyphenmon.alert.engine.notification.transport.webhook.slack;

public class Text {
  public static final String MARKDOWN_TYPE = "mrkdwn";
  private final String type;
  private final String text;

  public Text(String type, String text) {
    this.type = type;
    this.text = text;
  }

  public static Text markdown(String text) {
    return new Text(MARKDOWN_TYPE, text);
  }

  public String getType() {
    return type;
  }

  public String getText() {
    return text;
  }
}
