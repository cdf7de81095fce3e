package org.hyphenmon.alert.engine.notification.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.junit.jupiter.api.Test;

class AlertMessageFormatterTest {

  private final AlertEvent event =
      AlertEvent.builder()
          .ruleId("error-rate-exceeded")
          .fingerprint("abc123")
          .severity(Severity.CRITICAL)
          .message("Error rate 0.8 exceeded threshold")
          .createdAt(1_000)
          .build();

  @Test
  void testSubject() {
    assertEquals("[CRITICAL] error-rate-exceeded", AlertMessageFormatter.subject(event));
  }

  @Test
  void testBody() {
    String body = AlertMessageFormatter.body(event);
    assertTrue(body.contains("Fingerprint: abc123"));
    assertTrue(body.contains("Time: 1970-01-01T00:16:40Z"));
    assertTrue(body.endsWith("Error rate 0.8 exceeded threshold"));
  }
}
