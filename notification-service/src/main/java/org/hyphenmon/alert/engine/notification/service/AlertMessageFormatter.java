package org.hyphenmon.alert.engine.notification.service;

import java.time.Instant;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;

public class AlertMessageFormatter {

  private AlertMessageFormatter() {}

  public static String subject(AlertEvent event) {
    return String.format("[%s] %s", event.getSeverity(), event.getRuleId());
  }

  public static String body(AlertEvent event) {
    return String.format(
        "Rule: %s%nSeverity: %s%nFingerprint: %s%nTime: %s%n%n%s",
        event.getRuleId(),
        event.getSeverity(),
        event.getFingerprint(),
        Instant.ofEpochSecond(event.getCreatedAt()),
        event.getMessage());
  }
}
