package org.hyphenmon.alert.engine.metric.correlation.datamodel.validation;

import org.apache.commons.lang3.StringUtils;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.MalformedRecordException;

public class MetricRecordValidator {

  private MetricRecordValidator() {}

  public static MetricRecord validate(MetricRecord record, MetricSource expectedSource) {
    if (record.getSource() != expectedSource) {
      throw new MalformedRecordException(
          String.format(
              "Expected %s record, got %s for key %s",
              expectedSource, record.getSource(), record.getKey()));
    }
    if (StringUtils.isBlank(record.getKey())) {
      throw new MalformedRecordException("Record has no key: " + record);
    }
    if (record.getTimestamp() <= 0) {
      throw new MalformedRecordException("Record has no valid timestamp: " + record);
    }
    if (!Double.isFinite(record.getValue())) {
      throw new MalformedRecordException("Record value is not a finite number: " + record);
    }
    return record;
  }
}
