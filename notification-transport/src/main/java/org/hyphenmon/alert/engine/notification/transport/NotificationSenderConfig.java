package org.hyphenmon.alert.engine.notification.transport;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Map;
import org.hyphenmon.alert.engine.notification.transport.mail.MailSenderConfig;

/** Settings shared by the senders, read from the {@code notification.config} block. */
public class NotificationSenderConfig {
  public static final String NOTIFICATION_CONFIG = "notification.config";
  private static final String HTTP_TIMEOUT = "http.timeout";
  private static final String SMTP = "smtp";
  private static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final Config rawConfig;
  private final Duration httpTimeout;
  private final MailSenderConfig mailSenderConfig;

  public static NotificationSenderConfig from(Config config) {
    return new NotificationSenderConfig(
        config.hasPath(NOTIFICATION_CONFIG)
            ? config.getConfig(NOTIFICATION_CONFIG)
            : ConfigFactory.parseMap(Map.of()));
  }

  private NotificationSenderConfig(Config notificationConfig) {
    this.rawConfig = notificationConfig;
    this.httpTimeout =
        notificationConfig.hasPath(HTTP_TIMEOUT)
            ? notificationConfig.getDuration(HTTP_TIMEOUT)
            : DEFAULT_HTTP_TIMEOUT;
    this.mailSenderConfig =
        notificationConfig.hasPath(SMTP)
            ? MailSenderConfig.from(notificationConfig.getConfig(SMTP))
            : null;
  }

  public Duration getHttpTimeout() {
    return httpTimeout;
  }

  /** Null when no SMTP server is configured. */
  public MailSenderConfig getMailSenderConfig() {
    return mailSenderConfig;
  }

  public Config getRawConfig() {
    return rawConfig;
  }
}
