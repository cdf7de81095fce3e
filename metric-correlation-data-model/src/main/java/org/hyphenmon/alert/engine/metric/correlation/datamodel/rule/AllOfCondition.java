package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AllOfCondition implements RuleCondition {
  @Singular List<RuleCondition> conditions;

  @Override
  public ConditionType getType() {
    return ConditionType.ALL_OF;
  }
}
