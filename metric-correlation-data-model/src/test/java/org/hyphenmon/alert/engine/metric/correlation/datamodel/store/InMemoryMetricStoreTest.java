package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.junit.jupiter.api.Test;

class InMemoryMetricStoreTest {

  private static MetricRecord record(
      MetricSource source, String key, long timestamp, long recordedAt) {
    return MetricRecord.builder()
        .source(source)
        .key(key)
        .timestamp(timestamp)
        .value(1.0)
        .recordedAt(recordedAt)
        .build();
  }

  @Test
  void testQueryRangeIsExclusiveOfSinceAndOrderedByTimestamp() {
    Clock clock = Clock.fixed(Instant.ofEpochSecond(2_000), ZoneOffset.UTC);
    InMemoryMetricStore store = new InMemoryMetricStore(Duration.ofHours(1), clock);
    store.append(record(MetricSource.APP, "error_rate", 1_010, 1_100));
    store.append(record(MetricSource.APP, "error_rate", 1_000, 1_101));
    store.append(record(MetricSource.APP, "error_rate", 990, 1_200));
    store.append(record(MetricSource.EXTERNAL, "23298", 995, 1_101));

    List<MetricRecord> app = store.queryRange(MetricSource.APP, 1_100, 1_200);
    assertEquals(
        List.of(990L, 1_000L),
        app.stream().map(MetricRecord::getTimestamp).collect(Collectors.toList()));

    List<MetricRecord> external = store.queryRange(MetricSource.EXTERNAL, 1_100, 1_200);
    assertEquals(1, external.size());
    assertEquals("23298", external.get(0).getKey());
  }

  @Test
  void testRecordsOutsideRetentionAreDropped() {
    Clock clock = Clock.fixed(Instant.ofEpochSecond(10_000), ZoneOffset.UTC);
    InMemoryMetricStore store = new InMemoryMetricStore(Duration.ofMinutes(10), clock);
    store.append(record(MetricSource.APP, "error_rate", 8_000, 8_000));
    store.append(record(MetricSource.APP, "error_rate", 9_900, 9_900));

    assertEquals(1, store.size(MetricSource.APP));
    assertTrue(store.queryRange(MetricSource.APP, 0, 10_000).stream()
        .allMatch(r -> r.getRecordedAt() == 9_900));
  }
}
