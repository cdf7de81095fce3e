package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

public enum ConditionType {
  APP_THRESHOLD,
  EXTERNAL_THRESHOLD,
  UNMATCHED,
  ALL_OF
}
