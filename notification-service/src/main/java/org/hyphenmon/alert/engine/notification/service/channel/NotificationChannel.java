package org.hyphenmon.alert.engine.notification.service.channel;

import java.util.List;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;

/**
 * A configured destination for alerts. Each channel delivers to its own recipients (mail
 * addresses or webhook URLs) and only receives events at or above {@code minSeverity}.
 */
@SuperBuilder
@Getter
public abstract class NotificationChannel {
  private final String channelName;
  private final String channelType;
  private final Severity minSeverity;
  private final List<String> recipients;

  public boolean accepts(Severity severity) {
    return severity.isAtLeast(minSeverity);
  }

  /** Returns true when the recipient accepted the notification. */
  public abstract boolean send(String subject, String body, String recipient);
}
