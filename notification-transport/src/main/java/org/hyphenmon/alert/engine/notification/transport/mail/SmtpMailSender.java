package org.hyphenmon.alert.engine.notification.transport.mail;

import com.google.common.annotations.VisibleForTesting;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends plain text mail through one SMTP relay. */
public class SmtpMailSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(SmtpMailSender.class);
  private final MailSenderConfig config;
  private final Session session;

  public SmtpMailSender(MailSenderConfig config) {
    this.config = config;
    this.session = Session.getInstance(toProperties(config), authenticator(config));
  }

  public boolean send(String recipient, String subject, String body) {
    try {
      Transport.send(buildMessage(recipient, subject, body));
      LOGGER.debug("Mail '{}' sent to {}", subject, recipient);
      return true;
    } catch (MessagingException e) {
      LOGGER.error(
          "Unable to send mail '{}' to {} through {}:{}",
          subject,
          recipient,
          config.getHost(),
          config.getPort(),
          e);
      return false;
    }
  }

  @VisibleForTesting
  MimeMessage buildMessage(String recipient, String subject, String body)
      throws MessagingException {
    MimeMessage message = new MimeMessage(session);
    message.setFrom(new InternetAddress(config.getFrom()));
    message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(recipient));
    message.setSubject(subject, StandardCharsets.UTF_8.name());
    message.setText(body, StandardCharsets.UTF_8.name());
    message.setSentDate(new Date());
    return message;
  }

  @VisibleForTesting
  static Properties toProperties(MailSenderConfig config) {
    String timeoutMillis = String.valueOf(config.getTimeout().toMillis());
    Properties properties = new Properties();
    properties.put("mail.smtp.host", config.getHost());
    properties.put("mail.smtp.port", String.valueOf(config.getPort()));
    properties.put("mail.smtp.auth", String.valueOf(config.hasCredentials()));
    properties.put("mail.smtp.starttls.enable", String.valueOf(config.isStartTls()));
    properties.put("mail.smtp.connectiontimeout", timeoutMillis);
    properties.put("mail.smtp.timeout", timeoutMillis);
    properties.put("mail.smtp.writetimeout", timeoutMillis);
    return properties;
  }

  private static Authenticator authenticator(MailSenderConfig config) {
    if (!config.hasCredentials()) {
      return null;
    }
    return new Authenticator() {
      @Override
      protected PasswordAuthentication getPasswordAuthentication() {
        return new PasswordAuthentication(config.getUsername(), config.getPassword());
      }
    };
  }
}
