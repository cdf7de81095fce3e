package org.hyphenmon.alert.engine.metric.correlation.datamodel;

public enum Severity {
  WARN,
  CRITICAL;

  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }
}
