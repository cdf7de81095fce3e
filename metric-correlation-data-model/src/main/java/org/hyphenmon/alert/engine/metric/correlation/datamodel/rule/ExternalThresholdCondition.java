package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Holds when any matched external record identified by {@code item} (item id or item name)
 * crosses the threshold.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExternalThresholdCondition implements RuleCondition {
  String item;
  ThresholdOperator operator;
  Double threshold;

  @Override
  public ConditionType getType() {
    return ConditionType.EXTERNAL_THRESHOLD;
  }
}
