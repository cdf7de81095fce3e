package org.hyphenmon.alert.engine.state;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.DeliveryRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.DeliveryRecords;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.DeliveryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeliveryStore} kept in memory and written through to a JSON file on every upsert, so
 * suppression and pending retries survive a restart.
 */
public class FileDeliveryStore implements DeliveryStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileDeliveryStore.class);

  private final JsonStateFile<List<DeliveryRecord>> file;
  private final Map<String, DeliveryRecord> records = new LinkedHashMap<>();

  public FileDeliveryStore(Path path) throws IOException {
    this.file = new JsonStateFile<>(path, new TypeReference<List<DeliveryRecord>>() {});
    for (DeliveryRecord record : file.read().orElse(List.of())) {
      records.put(record.getFingerprint(), record);
    }
    LOGGER.info("Loaded {} delivery records from {}", records.size(), path);
  }

  @Override
  public synchronized Optional<DeliveryRecord> get(String fingerprint) {
    return Optional.ofNullable(records.get(fingerprint));
  }

  @Override
  public synchronized void upsert(DeliveryRecord deliveryRecord) {
    DeliveryRecord previous = records.put(deliveryRecord.getFingerprint(), deliveryRecord);
    try {
      file.write(new ArrayList<>(records.values()));
    } catch (IOException e) {
      if (previous == null) {
        records.remove(deliveryRecord.getFingerprint());
      } else {
        records.put(previous.getFingerprint(), previous);
      }
      throw new UncheckedIOException("Unable to write " + file.getPath(), e);
    }
  }

  @Override
  public synchronized List<DeliveryRecord> getUndelivered() {
    return records.values().stream()
        .filter(r -> !r.isDelivered() && !r.isPermanentlyFailed())
        .collect(Collectors.toUnmodifiableList());
  }

  @Override
  public synchronized int purgeOlderThan(long lastAttemptBefore) {
    Map<String, DeliveryRecord> snapshot = new LinkedHashMap<>(records);
    records.values().removeIf(r -> DeliveryRecords.isExpired(r, lastAttemptBefore));
    int purged = snapshot.size() - records.size();
    if (purged == 0) {
      return 0;
    }
    try {
      file.write(new ArrayList<>(records.values()));
    } catch (IOException e) {
      records.clear();
      records.putAll(snapshot);
      throw new UncheckedIOException("Unable to write " + file.getPath(), e);
    }
    return purged;
  }
}
