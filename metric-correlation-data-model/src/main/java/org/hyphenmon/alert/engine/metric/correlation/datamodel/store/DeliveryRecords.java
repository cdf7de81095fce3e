package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import org.hyphenmon.alert.engine.metric.correlation.datamodel.DeliveryRecord;

public class DeliveryRecords {

  private DeliveryRecords() {}

  /** True for a settled record, delivered or permanently failed, last attempted before cutoff. */
  public static boolean isExpired(DeliveryRecord record, long lastAttemptBefore) {
    return (record.isDelivered() || record.isPermanentlyFailed())
        && record.getLastAttemptAt() < lastAttemptBefore;
  }
}
