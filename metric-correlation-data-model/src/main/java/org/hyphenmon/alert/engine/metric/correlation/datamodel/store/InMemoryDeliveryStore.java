package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.DeliveryRecord;

public class InMemoryDeliveryStore implements DeliveryStore {
  private final ConcurrentMap<String, DeliveryRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<DeliveryRecord> get(String fingerprint) {
    return Optional.ofNullable(records.get(fingerprint));
  }

  @Override
  public void upsert(DeliveryRecord deliveryRecord) {
    records.put(deliveryRecord.getFingerprint(), deliveryRecord);
  }

  @Override
  public List<DeliveryRecord> getUndelivered() {
    return records.values().stream()
        .filter(r -> !r.isDelivered() && !r.isPermanentlyFailed())
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public int purgeOlderThan(long lastAttemptBefore) {
    int purged = 0;
    for (DeliveryRecord record : records.values()) {
      // a record replaced concurrently is no longer the one that expired
      if (DeliveryRecords.isExpired(record, lastAttemptBefore)
          && records.remove(record.getFingerprint(), record)) {
        purged++;
      }
    }
    return purged;
  }
}
