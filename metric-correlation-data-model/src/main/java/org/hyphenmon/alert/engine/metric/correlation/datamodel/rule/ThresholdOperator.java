package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

public enum ThresholdOperator {
  GT,
  GTE,
  LT,
  LTE
}
