package org.hyphenmon.alert.engine.cycle;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;
import org.hyphenmon.alert.engine.notification.service.dispatcher.DispatchResult;

/**
 * What one run of the {@link CorrelationCycle} did. For an aborted run {@code failedStage} names
 * the stage that was in progress and the lists are empty.
 */
@Value
@Builder
public class CycleReport {
  String cycleId;
  boolean completed;
  CycleState failedStage;
  @Singular List<AlertEvent> events;
  @Singular List<DispatchResult> dispatchResults;
  Long watermark;

  static CycleReport aborted(String cycleId, CycleState stage) {
    return CycleReport.builder().cycleId(cycleId).completed(false).failedStage(stage).build();
  }
}
