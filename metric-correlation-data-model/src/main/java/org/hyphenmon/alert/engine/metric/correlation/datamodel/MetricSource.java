package org.hyphenmon.alert.engine.metric.correlation.datamodel;

public enum MetricSource {
  /** Application level metrics polled from the metrics endpoint. */
  APP,
  /** Items reported by the external monitoring system. */
  EXTERNAL
}
