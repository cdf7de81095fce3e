package org.hyphenmon.alert.engine.metric.correlation.datamodel.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnomalyRule {
  String id;
  RuleCondition condition;
  Severity severity;
  String messageTemplate;
}
