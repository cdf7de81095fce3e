package org.hyphenmon.alert.engine.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.ConfigFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.AlertEvent;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.DeliveryRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Watermark;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.InMemoryDeliveryStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.InMemoryWatermarkStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileStoresTest {

  @TempDir Path stateDir;

  private static DeliveryRecord record(String fingerprint, boolean delivered, int attempts) {
    return DeliveryRecord.builder()
        .fingerprint(fingerprint)
        .lastAttemptAt(1_060)
        .attemptCount(attempts)
        .delivered(delivered)
        .event(
            AlertEvent.builder()
                .ruleId("error-rate-exceeded")
                .fingerprint(fingerprint)
                .severity(Severity.CRITICAL)
                .message("Error rate 0.8 exceeded threshold at 1000")
                .createdAt(1_060)
                .build())
        .build();
  }

  private List<String> fileNames() throws Exception {
    try (Stream<Path> files = Files.list(stateDir)) {
      return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }

  @Test
  void testWatermarkSurvivesReopen() throws Exception {
    Path path = stateDir.resolve("watermark.json");
    FileWatermarkStore store = new FileWatermarkStore(path);
    assertEquals(Optional.empty(), store.read());

    store.write(Watermark.of(1_051));
    store.write(Watermark.of(1_120));

    assertEquals(Optional.of(Watermark.of(1_120)), new FileWatermarkStore(path).read());
    assertEquals(List.of("watermark.json"), fileNames());
  }

  @Test
  void testDeliveryRecordsSurviveReopen() throws Exception {
    Path path = stateDir.resolve("nested").resolve("delivery-records.json");
    FileDeliveryStore store = new FileDeliveryStore(path);
    store.upsert(record("fp-1", true, 1));
    store.upsert(record("fp-2", false, 2));
    store.upsert(record("fp-2", false, 3));

    FileDeliveryStore reopened = new FileDeliveryStore(path);

    assertEquals(store.get("fp-1"), reopened.get("fp-1"));
    assertTrue(reopened.get("fp-1").get().isDelivered());
    List<DeliveryRecord> undelivered = reopened.getUndelivered();
    assertEquals(1, undelivered.size());
    assertEquals(3, undelivered.get(0).getAttemptCount());
    assertEquals(Severity.CRITICAL, undelivered.get(0).getEvent().getSeverity());
    assertFalse(reopened.get("fp-3").isPresent());
  }

  @Test
  void testPurgedRecordsStayGoneAfterReopen() throws Exception {
    Path path = stateDir.resolve("delivery-records.json");
    FileDeliveryStore store = new FileDeliveryStore(path);
    store.upsert(record("fp-1", true, 1));
    store.upsert(record("fp-2", false, 2));
    store.upsert(record("fp-3", true, 1).toBuilder().lastAttemptAt(2_000).build());

    assertEquals(0, store.purgeOlderThan(1_060));
    assertEquals(1, store.purgeOlderThan(1_061));

    FileDeliveryStore reopened = new FileDeliveryStore(path);
    assertFalse(reopened.get("fp-1").isPresent());
    assertEquals(2, reopened.get("fp-2").get().getAttemptCount());
    assertTrue(reopened.get("fp-3").isPresent());
  }

  @Test
  void testStateStoresFromConfig() throws Exception {
    StateStores fileStores =
        StateStores.from(
            ConfigFactory.parseMap(
                Map.of("state.type", "file", "state.dir", stateDir.toString())));
    fileStores.getWatermarkStore().write(Watermark.of(42));
    assertInstanceOf(FileWatermarkStore.class, fileStores.getWatermarkStore());
    assertInstanceOf(FileDeliveryStore.class, fileStores.getDeliveryStore());
    assertTrue(Files.exists(stateDir.resolve(StateStores.WATERMARK_FILE)));

    StateStores memoryStores =
        StateStores.from(ConfigFactory.parseMap(Map.of("state.type", "memory")));
    assertInstanceOf(InMemoryWatermarkStore.class, memoryStores.getWatermarkStore());
    assertInstanceOf(InMemoryDeliveryStore.class, memoryStores.getDeliveryStore());

    assertThrows(
        RuntimeException.class,
        () -> StateStores.from(ConfigFactory.parseMap(Map.of("state.type", "redis"))));
  }
}
