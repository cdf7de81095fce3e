package org.hyphenmon.alert.engine.notification.service.dispatcher;

import lombok.Value;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;

@Value(staticConstructor = "of")
public class DispatchResult {
  AlertEvent event;
  DispatchOutcome outcome;
}
