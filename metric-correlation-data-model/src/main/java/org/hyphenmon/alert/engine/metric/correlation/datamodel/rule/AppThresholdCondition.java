package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Holds when the application record of a result is {@code field} and its value crosses. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppThresholdCondition implements RuleCondition {
  String field;
  ThresholdOperator operator;
  Double threshold;

  @Override
  public ConditionType getType() {
    return ConditionType.APP_THRESHOLD;
  }
}
