package org.hyphenmon.alert.engine.metric.correlation.datamodel;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class CorrelationResult {
  MetricRecord appRecord;
  @NonNull List<MetricRecord> externalRecords;
  long windowStart;
  long windowEnd;
  boolean matched;

  public Optional<MetricRecord> getAppRecordIfPresent() {
    return Optional.ofNullable(appRecord);
  }
}
