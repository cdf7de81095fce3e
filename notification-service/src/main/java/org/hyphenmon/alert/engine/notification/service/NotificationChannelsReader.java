package org.hyphenmon.alert.engine.notification.service;

import com.typesafe.config.Config;
import java.util.ArrayList;
import java.util.List;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.hyphenmon.alert.engine.notification.service.channel.MailNotificationChannel;
import org.hyphenmon.alert.engine.notification.service.channel.NotificationChannel;
import org.hyphenmon.alert.engine.notification.service.channel.SlackNotificationChannel;
import org.hyphenmon.alert.engine.notification.service.channel.WebhookNotificationChannel;
import org.hyphenmon.alert.engine.notification.transport.NotificationSenderConfig;
import org.hyphenmon.alert.engine.notification.transport.mail.SmtpMailSender;
import org.hyphenmon.alert.engine.notification.transport.webhook.WebhookSender;
import org.hyphenmon.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the notification channels listed under {@code notificationChannels.channels}. Entries
 * that cannot be built are logged and left out.
 */
public class NotificationChannelsReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationChannelsReader.class);
  public static final String NOTIFICATION_CHANNELS = "notificationChannels";
  private static final String CHANNELS = "channels";
  private static final String CHANNEL_NAME = "channelName";
  private static final String CHANNEL_TYPE = "channelType";
  private static final String MIN_SEVERITY = "minSeverity";
  private static final String RECIPIENTS = "recipients";
  public static final String CHANNEL_TYPE_EMAIL = "EMAIL";
  public static final String CHANNEL_TYPE_WEBHOOK = "WEBHOOK";
  public static final String CHANNEL_TYPE_SLACK = "SLACK";

  private final NotificationSenderConfig senderConfig;

  public NotificationChannelsReader(NotificationSenderConfig senderConfig) {
    this.senderConfig = senderConfig;
  }

  public List<NotificationChannel> readNotificationChannels(Config appConfig) {
    String path = NOTIFICATION_CHANNELS + "." + CHANNELS;
    if (!appConfig.hasPath(path)) {
      LOGGER.warn("No notification channels configured, alerts will not be delivered");
      return List.of();
    }
    WebhookSender webhookSender =
        new WebhookSender(HttpWithJsonSender.create(senderConfig.getHttpTimeout()));
    SmtpMailSender mailSender = null;

    List<NotificationChannel> channels = new ArrayList<>();
    for (Config channelConfig : appConfig.getConfigList(path)) {
      String channelName = channelConfig.getString(CHANNEL_NAME);
      String channelType = channelConfig.getString(CHANNEL_TYPE);
      Severity minSeverity =
          channelConfig.hasPath(MIN_SEVERITY)
              ? channelConfig.getEnum(Severity.class, MIN_SEVERITY)
              : Severity.WARN;
      List<String> recipients = channelConfig.getStringList(RECIPIENTS);

      switch (channelType) {
        case CHANNEL_TYPE_EMAIL:
          if (senderConfig.getMailSenderConfig() == null) {
            LOGGER.error("Channel {} needs notification.config.smtp, skipping it", channelName);
            continue;
          }
          if (mailSender == null) {
            mailSender = new SmtpMailSender(senderConfig.getMailSenderConfig());
          }
          channels.add(
              MailNotificationChannel.builder()
                  .channelName(channelName)
                  .channelType(channelType)
                  .minSeverity(minSeverity)
                  .recipients(recipients)
                  .mailSender(mailSender)
                  .build());
          break;
        case CHANNEL_TYPE_WEBHOOK:
          channels.add(
              WebhookNotificationChannel.builder()
                  .channelName(channelName)
                  .channelType(channelType)
                  .minSeverity(minSeverity)
                  .recipients(recipients)
                  .webhookSender(webhookSender)
                  .build());
          break;
        case CHANNEL_TYPE_SLACK:
          channels.add(
              SlackNotificationChannel.builder()
                  .channelName(channelName)
                  .channelType(channelType)
                  .minSeverity(minSeverity)
                  .recipients(recipients)
                  .webhookSender(webhookSender)
                  .build());
          break;
        default:
          LOGGER.error("Unknown channel type {} for channel {}", channelType, channelName);
      }
    }
    LOGGER.info("Configured {} notification channels", channels.size());
    return List.copyOf(channels);
  }
}
