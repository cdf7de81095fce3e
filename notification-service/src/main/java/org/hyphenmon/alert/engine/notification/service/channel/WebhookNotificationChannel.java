package org.hyphenmon.alert.engine.notification.service.channel;

import java.time.Instant;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import org.hyphenmon.alert.engine.notification.transport.webhook.WebhookSender;

/** Posts a small JSON document to each recipient URL. */
@SuperBuilder
public class WebhookNotificationChannel extends NotificationChannel {
  private final WebhookSender webhookSender;

  @Override
  public boolean send(String subject, String body, String recipient) {
    return webhookSender.send(
        recipient,
        AlertWebhookEvent.builder()
            .subject(subject)
            .body(body)
            .sentAt(Instant.now().toString())
            .build());
  }

  @SuperBuilder
  @Getter
  static class AlertWebhookEvent {
    private final String subject;
    private final String body;
    private final String sentAt;
  }
}
