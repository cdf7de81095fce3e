package org.hyphenmon.alert.engine.notification.transport.mail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.typesafe.config.ConfigFactory;
import jakarta.mail.Message;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class SmtpMailSenderTest {

  private static MailSenderConfig config(int port, Duration timeout) {
    return MailSenderConfig.builder()
        .host("127.0.0.1")
        .port(port)
        .username("alerts")
        .password("secret")
        .from("alerts@hyphenmon.local")
        .startTls(true)
        .timeout(timeout)
        .build();
  }

  @Test
  void testBuildMessage() throws Exception {
    SmtpMailSender sender = new SmtpMailSender(config(587, Duration.ofSeconds(10)));

    MimeMessage message =
        sender.buildMessage("ops@example.com", "[CRITICAL] error-rate-exceeded", "body");

    assertEquals("[CRITICAL] error-rate-exceeded", message.getSubject());
    assertEquals(
        "ops@example.com",
        ((InternetAddress) message.getRecipients(Message.RecipientType.TO)[0]).getAddress());
    assertEquals("alerts@hyphenmon.local", ((InternetAddress) message.getFrom()[0]).getAddress());
  }

  @Test
  void testSessionProperties() {
    Properties properties = SmtpMailSender.toProperties(config(2525, Duration.ofSeconds(3)));

    assertEquals("2525", properties.getProperty("mail.smtp.port"));
    assertEquals("true", properties.getProperty("mail.smtp.auth"));
    assertEquals("true", properties.getProperty("mail.smtp.starttls.enable"));
    assertEquals("3000", properties.getProperty("mail.smtp.connectiontimeout"));
    assertEquals("3000", properties.getProperty("mail.smtp.timeout"));
  }

  @Test
  void testUnreachableServerIsFailure() {
    // port 1 is not listening on the loopback interface
    SmtpMailSender sender = new SmtpMailSender(config(1, Duration.ofSeconds(2)));
    assertFalse(sender.send("ops@example.com", "subject", "body"));
  }

  @Test
  void testConfigDefaults() {
    MailSenderConfig config =
        MailSenderConfig.from(
            ConfigFactory.parseMap(
                Map.of(
                    "host", "smtp.example.com",
                    "from", "alerts@example.com",
                    "username", "alerts",
                    "password", "pw")));

    assertEquals(587, config.getPort());
    assertEquals(true, config.isStartTls());
    assertEquals(Duration.ofSeconds(10), config.getTimeout());
  }
}
