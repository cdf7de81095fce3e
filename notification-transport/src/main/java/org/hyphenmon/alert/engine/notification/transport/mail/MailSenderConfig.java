package org.hyphenmon.alert.engine.notification.transport.mail;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;
import org.hyphenmon.alert.engine.notification.transport.NotificationSecretFinder;

@Value
@Builder
public class MailSenderConfig {
  static final int DEFAULT_PORT = 587;
  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  static final String PASSWORD_SECRET_KEY = "smtp-password";

  String host;
  int port;
  String username;
  String password;
  String from;
  boolean startTls;
  Duration timeout;

  public static MailSenderConfig from(Config smtpConfig) {
    String password =
        smtpConfig.hasPath("password")
            ? smtpConfig.getString("password")
            : NotificationSecretFinder.findSecret(PASSWORD_SECRET_KEY).orElse(null);
    return MailSenderConfig.builder()
        .host(smtpConfig.getString("host"))
        .port(smtpConfig.hasPath("port") ? smtpConfig.getInt("port") : DEFAULT_PORT)
        .username(smtpConfig.hasPath("username") ? smtpConfig.getString("username") : null)
        .password(password)
        .from(smtpConfig.getString("from"))
        .startTls(!smtpConfig.hasPath("startTls") || smtpConfig.getBoolean("startTls"))
        .timeout(
            smtpConfig.hasPath("timeout") ? smtpConfig.getDuration("timeout") : DEFAULT_TIMEOUT)
        .build();
  }

  public boolean hasCredentials() {
    return username != null && password != null;
  }
}
