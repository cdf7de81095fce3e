package org.hyphenmon.alert.engine.notification.transport.webhook.slack;

public interface Block {
  String getType();
}
