package org.hyphenmon.alert.engine.notification.service.channel;

import lombok.experimental.SuperBuilder;
import org.hyphenmon.alert.engine.notification.transport.mail.SmtpMailSender;

@SuperBuilder
public class MailNotificationChannel extends NotificationChannel {
  private final SmtpMailSender mailSender;

  @Override
  public boolean send(String subject, String body, String recipient) {
    return mailSender.send(recipient, subject, body);
  }
}
