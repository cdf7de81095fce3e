package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import java.util.List;
import java.util.Optional;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.DeliveryRecord;

public interface DeliveryStore {

  Optional<DeliveryRecord> get(String fingerprint);

  void upsert(DeliveryRecord deliveryRecord);

  /** Records that are neither delivered nor permanently failed. */
  List<DeliveryRecord> getUndelivered();

  /**
   * Drops delivered and permanently failed records last attempted before {@code
   * lastAttemptBefore} (epoch seconds). Records still pending a retry are kept regardless of age.
   *
   * @return the number of records dropped
   */
  int purgeOlderThan(long lastAttemptBefore);
}
