package org.hyphenmon.alert.engine.notification.service.channel;

import java.util.List;
import lombok.experimental.SuperBuilder;
import org.hyphenmon.alert.engine.notification.transport.webhook.WebhookSender;
import org.hyphenmon.alert.engine.notification.transport.webhook.slack.Attachment;
import org.hyphenmon.alert.engine.notification.transport.webhook.slack.SectionBlock;
import org.hyphenmon.alert.engine.notification.transport.webhook.slack.SlackMessage;
import org.hyphenmon.alert.engine.notification.transport.webhook.slack.Text;

/** Slack incoming webhook; recipients are webhook URLs. */
@SuperBuilder
public class SlackNotificationChannel extends NotificationChannel {
  private final WebhookSender webhookSender;

  @Override
  public boolean send(String subject, String body, String recipient) {
    return webhookSender.send(recipient, toSlackMessage(subject, body));
  }

  static SlackMessage toSlackMessage(String subject, String body) {
    Attachment attachment = new Attachment();
    attachment.setColor(subject.startsWith("[CRITICAL]") ? Attachment.RED : Attachment.ORANGE);
    attachment.setBlocks(
        List.of(
            SectionBlock.withText(Text.markdown("*" + subject + "*")),
            SectionBlock.withText(Text.markdown("```" + body + "```"))));
    return new SlackMessage(subject, List.of(attachment));
  }
}
