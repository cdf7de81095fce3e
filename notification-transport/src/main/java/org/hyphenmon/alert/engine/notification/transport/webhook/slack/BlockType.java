package org.hyphenmon.alert.engine.notification.transport.webhook.slack;

public enum BlockType {
  SECTION
}
