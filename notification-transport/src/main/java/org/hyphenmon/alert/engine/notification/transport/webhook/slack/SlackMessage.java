package org.hyphenmon.alert.engine.notification.transport.webhook.slack;

import java.util.List;

/** Body of a Slack incoming-webhook post. {@code text} is the notification fallback. */
public class SlackMessage {
  private final String text;
  private final List<Attachment> attachments;

  public SlackMessage(String text, List<Attachment> attachments) {
    this.text = text;
    this.attachments = attachments;
  }

  public String getText() {
    return text;
  }

  public List<Attachment> getAttachments() {
    return attachments;
  }
}
