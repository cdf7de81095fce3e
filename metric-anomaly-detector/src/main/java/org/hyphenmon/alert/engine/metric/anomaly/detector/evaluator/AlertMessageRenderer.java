package org.hyphenmon.alert.engine.metric.anomaly.detector.evaluator;

import org.apache.commons.lang3.StringUtils;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.CorrelationResult;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.rule.AnomalyRule;

class AlertMessageRenderer {
  private static final String[] PLACEHOLDERS = {
    "{rule_id}", "{key}", "{value}", "{timestamp}", "{window_start}", "{window_end}",
    "{matched_count}"
  };

  String render(AnomalyRule rule, CorrelationResult result) {
    MetricRecord appRecord = result.getAppRecord();
    String[] values = {
      rule.getId(),
      appRecord == null ? "" : appRecord.getKey(),
      appRecord == null ? "" : String.valueOf(appRecord.getValue()),
      appRecord == null ? "" : String.valueOf(appRecord.getTimestamp()),
      String.valueOf(result.getWindowStart()),
      String.valueOf(result.getWindowEnd()),
      String.valueOf(result.getExternalRecords().size())
    };
    return StringUtils.replaceEach(rule.getMessageTemplate(), PLACEHOLDERS, values);
  }
}
