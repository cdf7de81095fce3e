package org.hyphenmon.alert.engine.metric.correlation.datamodel;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A single timestamped value from one of the two metric streams. {@code key} is the field name
 * for {@link MetricSource#APP} records and the monitoring item id for {@link
 * MetricSource#EXTERNAL} records.
 */
@Value
@Builder(toBuilder = true)
public class MetricRecord {
  @NonNull MetricSource source;
  String key;
  // seconds, source clock
  long timestamp;
  double value;
  // seconds, ingestion clock
  long recordedAt;
  @Singular Map<String, String> labels;

  public String identity() {
    return source + ":" + key + ":" + timestamp;
  }

  public String getLabel(String name) {
    return labels.get(name);
  }
}
