package org.hyphenmon.alert.engine.metric.correlation.datamodel.store;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process local {@link MetricStore}. Records older than the retention period (by {@code
 * recordedAt}) are dropped on append.
 */
public class InMemoryMetricStore implements MetricStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMetricStore.class);

  private final Map<MetricSource, List<MetricRecord>> records = new EnumMap<>(MetricSource.class);
  private final Duration retention;
  private final Clock clock;

  public InMemoryMetricStore(Duration retention, Clock clock) {
    Preconditions.checkArgument(!retention.isNegative(), "retention must not be negative");
    this.retention = retention;
    this.clock = clock;
    for (MetricSource source : MetricSource.values()) {
      records.put(source, new ArrayList<>());
    }
  }

  @Override
  public synchronized void append(MetricRecord record) {
    List<MetricRecord> stream = records.get(record.getSource());
    stream.add(record);
    long horizon = clock.instant().getEpochSecond() - retention.getSeconds();
    if (stream.get(0).getRecordedAt() < horizon) {
      int before = stream.size();
      stream.removeIf(r -> r.getRecordedAt() < horizon);
      LOGGER.debug(
          "Dropped {} {} records older than {}",
          before - stream.size(),
          record.getSource(),
          horizon);
    }
  }

  @Override
  public synchronized List<MetricRecord> queryRange(MetricSource source, long since, long until) {
    return records.get(source).stream()
        .filter(r -> r.getRecordedAt() > since && r.getRecordedAt() <= until)
        .sorted(Comparator.comparingLong(MetricRecord::getTimestamp))
        .collect(Collectors.toUnmodifiableList());
  }

  public synchronized int size(MetricSource source) {
    return records.get(source).size();
  }
}
