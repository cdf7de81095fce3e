package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Condition part of an {@link AnomalyRule}. Conditions are plain data, tagged by {@link
 * #getType()}; the detector interprets them against a correlation result.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = AppThresholdCondition.class, name = "APP_THRESHOLD"),
  @JsonSubTypes.Type(value = ExternalThresholdCondition.class, name = "EXTERNAL_THRESHOLD"),
  @JsonSubTypes.Type(value = UnmatchedCondition.class, name = "UNMATCHED"),
  @JsonSubTypes.Type(value = AllOfCondition.class, name = "ALL_OF")
})
public interface RuleCondition {
  ConditionType getType();
}
