package org.hyphenmon.alert.engine.notification.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import org.hyphenmon.alert.engine.notification.transport.mail.MailSenderConfig;
import org.junit.jupiter.api.Test;
import org.junitpioneer.jupiter.SetSystemProperty;

class NotificationSenderConfigTest {

  @Test
  void testDefaultsWithoutConfigBlock() {
    NotificationSenderConfig config = NotificationSenderConfig.from(ConfigFactory.empty());
    assertEquals(Duration.ofSeconds(10), config.getHttpTimeout());
    assertNull(config.getMailSenderConfig());
  }

  @Test
  @SetSystemProperty(key = "notification.secret.smtp-password", value = "from-property")
  void testSmtpPasswordFromSecret() {
    Config config =
        ConfigFactory.parseString(
            "notification.config { http.timeout = 3s, smtp { host = \"smtp.example.com\","
                + " port = 2525, from = \"alerts@example.com\", username = alerts } }");

    NotificationSenderConfig senderConfig = NotificationSenderConfig.from(config);
    MailSenderConfig mail = senderConfig.getMailSenderConfig();

    assertEquals(Duration.ofSeconds(3), senderConfig.getHttpTimeout());
    assertEquals(2525, mail.getPort());
    assertEquals("from-property", mail.getPassword());
  }
}
