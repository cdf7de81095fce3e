package org.hyphenmon.alert.engine.notification.service.dispatcher;

public enum DispatchOutcome {
  SENT,
  SUPPRESSED,
  FAILED
}
