package org.hyphenmon.alert.engine.metric.ingestion;

import io.micrometer.core.instrument.Counter;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.MalformedRecordException;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.metrics.EngineMetricsRegistry;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.store.MetricStore;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.validation.MetricRecordValidator;
import org.hyphenmon.alert.engine.metric.ingestion.client.AppMetricsClient;
import org.hyphenmon.alert.engine.metric.ingestion.client.ZabbixClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls both metric sources once and appends what they return to the metric store. A failing
 * source contributes nothing to this poll; the other source is still stored.
 *
 * <p>The monitoring API only reports each item's latest value, so an item whose clock has not
 * moved since the previous poll is not stored again.
 */
public class MetricIngestor {
  private static final Logger LOGGER = LoggerFactory.getLogger(MetricIngestor.class);
  private static final ConcurrentMap<String, Counter> fetchErrorCounter =
      new ConcurrentHashMap<>();
  private static final String FETCH_ERROR_COUNTER =
      "hyphenmon.alert.engine.ingestion.fetch.error";
  private static final ConcurrentMap<String, Counter> malformedCounter = new ConcurrentHashMap<>();
  private static final String MALFORMED_COUNTER = "hyphenmon.alert.engine.ingestion.malformed";

  private final AppMetricsClient appMetricsClient;
  private final ZabbixClient zabbixClient;
  private final MetricStore metricStore;
  private final ConcurrentMap<String, Long> lastExternalTimestamp = new ConcurrentHashMap<>();

  public MetricIngestor(
      AppMetricsClient appMetricsClient, ZabbixClient zabbixClient, MetricStore metricStore) {
    this.appMetricsClient = appMetricsClient;
    this.zabbixClient = zabbixClient;
    this.metricStore = metricStore;
  }

  /** Returns the number of records appended. */
  public int ingestOnce() {
    int appended = store(MetricSource.APP, fetchApp());
    appended += store(MetricSource.EXTERNAL, fetchExternal());
    return appended;
  }

  private List<MetricRecord> fetchApp() {
    try {
      return appMetricsClient.fetch();
    } catch (IOException | RuntimeException e) {
      countFetchError(MetricSource.APP);
      LOGGER.error("Unable to fetch application metrics", e);
      return List.of();
    }
  }

  private List<MetricRecord> fetchExternal() {
    if (zabbixClient == null) {
      return List.of();
    }
    try {
      return zabbixClient.getItems();
    } catch (IOException | RuntimeException e) {
      countFetchError(MetricSource.EXTERNAL);
      LOGGER.warn("Unable to fetch monitoring items, continuing without external records", e);
      return List.of();
    }
  }

  private int store(MetricSource source, List<MetricRecord> records) {
    int appended = 0;
    for (MetricRecord record : records) {
      try {
        MetricRecord valid = MetricRecordValidator.validate(record, source);
        if (source == MetricSource.EXTERNAL && !isNewSample(valid)) {
          LOGGER.debug("Item {} unchanged since {}", valid.getKey(), valid.getTimestamp());
          continue;
        }
        metricStore.append(valid);
        if (source == MetricSource.EXTERNAL) {
          lastExternalTimestamp.merge(valid.getKey(), valid.getTimestamp(), Math::max);
        }
        appended++;
      } catch (MalformedRecordException e) {
        malformedCounter
            .computeIfAbsent(
                source.name(),
                k -> EngineMetricsRegistry.registerCounter(MALFORMED_COUNTER, Map.of("source", k)))
            .increment();
        LOGGER.warn("Skipping malformed {} record: {}", source, e.getMessage());
      }
    }
    return appended;
  }

  private boolean isNewSample(MetricRecord record) {
    Long previous = lastExternalTimestamp.get(record.getKey());
    return previous == null || record.getTimestamp() > previous;
  }

  private void countFetchError(MetricSource source) {
    fetchErrorCounter
        .computeIfAbsent(
            source.name(),
            k -> EngineMetricsRegistry.registerCounter(FETCH_ERROR_COUNTER, Map.of("source", k)))
        .increment();
  }
}
