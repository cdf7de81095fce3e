package org.hyphenmon.alert.engine.metric.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.exception.MalformedRecordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the application metrics endpoint, which answers {@code {timestamp, response_time_ms,
 * error_rate}}, and turns one sample into one APP record per field.
 */
public class AppMetricsClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(AppMetricsClient.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static final String TIMESTAMP = "timestamp";
  static final List<String> FIELDS = List.of("response_time_ms", "error_rate");
  private static final String URL = "url";
  private static final String METRICS_ENDPOINT = "metricsEndpoint";
  private static final String TIMEOUT = "timeout";
  private static final String DEFAULT_METRICS_ENDPOINT = "/metrics";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  private final OkHttpClient client;
  private final String metricsUrl;
  private final Clock clock;

  @VisibleForTesting
  AppMetricsClient(OkHttpClient client, String metricsUrl, Clock clock) {
    this.client = client;
    this.metricsUrl = metricsUrl;
    this.clock = clock;
  }

  public static AppMetricsClient from(Config appConfig, Clock clock) {
    Duration timeout =
        appConfig.hasPath(TIMEOUT) ? appConfig.getDuration(TIMEOUT) : DEFAULT_TIMEOUT;
    String endpoint =
        appConfig.hasPath(METRICS_ENDPOINT)
            ? appConfig.getString(METRICS_ENDPOINT)
            : DEFAULT_METRICS_ENDPOINT;
    return new AppMetricsClient(
        new OkHttpClient.Builder().callTimeout(timeout).build(),
        stripTrailingSlash(appConfig.getString(URL)) + endpoint,
        clock);
  }

  public List<MetricRecord> fetch() throws IOException {
    Request request = new Request.Builder().url(metricsUrl).get().build();
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new IOException(
            String.format("Metrics endpoint %s answered %d", metricsUrl, response.code()));
      }
      return toRecords(OBJECT_MAPPER.readTree(body.string()));
    }
  }

  @VisibleForTesting
  List<MetricRecord> toRecords(JsonNode sample) {
    JsonNode timestamp = sample.get(TIMESTAMP);
    if (timestamp == null || !timestamp.canConvertToLong()) {
      throw new MalformedRecordException("Metrics sample has no numeric timestamp: " + sample);
    }
    long recordedAt = clock.instant().getEpochSecond();
    List<MetricRecord> records =
        FIELDS.stream()
            .filter(
                field -> {
                  JsonNode value = sample.get(field);
                  if (value == null || !value.isNumber()) {
                    LOGGER.warn("Metrics sample has no numeric {}: {}", field, sample);
                    return false;
                  }
                  return true;
                })
            .map(
                field ->
                    MetricRecord.builder()
                        .source(MetricSource.APP)
                        .key(field)
                        .timestamp(timestamp.asLong())
                        .value(sample.get(field).asDouble())
                        .recordedAt(recordedAt)
                        .build())
            .collect(Collectors.toUnmodifiableList());
    LOGGER.debug("Fetched {} application records at {}", records.size(), timestamp.asLong());
    return records;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
