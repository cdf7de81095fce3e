package org.hyphenmon.alert.engine.metric.correlation.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertEvent {
  @NonNull String ruleId;
  // de-duplication key
  @NonNull String fingerprint;
  @NonNull Severity severity;
  String message;
  long createdAt;
}
