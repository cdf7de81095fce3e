package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Holds when an application record found no external record inside the window. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnmatchedCondition implements RuleCondition {

  @Override
  public ConditionType getType() {
    return ConditionType.UNMATCHED;
  }
}
