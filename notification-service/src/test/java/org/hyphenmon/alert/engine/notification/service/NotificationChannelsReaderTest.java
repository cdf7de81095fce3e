package org.hyphenmon.alert.engine.notification.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.hyphenmon.alert.engine.notification.service.channel.MailNotificationChannel;
import org.hyphenmon.alert.engine.notification.service.channel.NotificationChannel;
import org.hyphenmon.alert.engine.notification.service.channel.SlackNotificationChannel;
import org.hyphenmon.alert.engine.notification.service.channel.WebhookNotificationChannel;
import org.hyphenmon.alert.engine.notification.transport.NotificationSenderConfig;
import org.junit.jupiter.api.Test;

class NotificationChannelsReaderTest {

  @Test
  void testReadNotificationChannels() {
    Config config = ConfigFactory.parseResources("notification-channels.conf").resolve();

    List<NotificationChannel> channels =
        new NotificationChannelsReader(NotificationSenderConfig.from(config))
            .readNotificationChannels(config);

    assertEquals(3, channels.size());
    NotificationChannel mail = channels.get(0);
    assertInstanceOf(MailNotificationChannel.class, mail);
    assertEquals("ops-mail", mail.getChannelName());
    assertEquals(List.of("ops@example.com", "oncall@example.com"), mail.getRecipients());
    assertEquals(Severity.WARN, mail.getMinSeverity());

    NotificationChannel slack = channels.get(1);
    assertInstanceOf(SlackNotificationChannel.class, slack);
    assertEquals(Severity.CRITICAL, slack.getMinSeverity());
    assertTrue(slack.accepts(Severity.CRITICAL));
    assertFalse(slack.accepts(Severity.WARN));

    assertInstanceOf(WebhookNotificationChannel.class, channels.get(2));
  }

  @Test
  void testMailChannelWithoutSmtpIsSkipped() {
    Config config =
        ConfigFactory.parseString(
            "notificationChannels.channels = [{channelName = mail, channelType = EMAIL,"
                + " recipients = [\"ops@example.com\"]}]");

    assertTrue(
        new NotificationChannelsReader(NotificationSenderConfig.from(config))
            .readNotificationChannels(config)
            .isEmpty());
  }

  @Test
  void testNoChannelsConfigured() {
    Config config = ConfigFactory.empty();
    assertTrue(
        new NotificationChannelsReader(NotificationSenderConfig.from(config))
            .readNotificationChannels(config)
            .isEmpty());
  }
}
