package org.hyphenmon.alert.engine.metric.correlation.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Delivery state of one incident, keyed by the alert fingerprint. {@code event} holds the last
 * event seen for the fingerprint so that an undelivered incident can be retried on a later cycle.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliveryRecord {
  @NonNull String fingerprint;
  long lastAttemptAt;
  int attemptCount;
  boolean delivered;
  boolean permanentlyFailed;
  AlertEvent event;
}
