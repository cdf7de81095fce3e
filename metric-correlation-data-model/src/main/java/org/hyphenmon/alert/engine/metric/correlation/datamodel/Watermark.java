package org.hyphenmon.alert.engine.metric.correlation.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Watermark {
  long lastProcessedRecordedAt;

  public static Watermark of(long lastProcessedRecordedAt) {
    return Watermark.builder().lastProcessedRecordedAt(lastProcessedRecordedAt).build();
  }
}
