package org.hyphenmon.alert.engine.metric.ingestion.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricRecord;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.MetricSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zabbix JSON-RPC client. Logs in with {@code user.login}, caches the session token and reads the
 * latest item values of one host with {@code item.get}. A rejected session triggers one fresh
 * login and one retry.
 */
public class ZabbixClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(ZabbixClient.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final MediaType JSON_RPC = MediaType.get("application/json-rpc");
  private static final String URL = "url";
  private static final String USERNAME = "username";
  private static final String PASSWORD = "password";
  private static final String HOST_ID = "hostId";
  private static final String TIMEOUT = "timeout";
  static final String DEFAULT_HOST_ID = "10105";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  private static final List<String> ITEM_OUTPUT =
      List.of("itemid", "name", "lastvalue", "lastclock", "hostid");
  private static final List<String> AUTH_ERROR_MARKERS =
      List.of("re-login", "Not authorised", "Not authorized", "Session terminated");

  private final OkHttpClient client;
  private final String url;
  private final String username;
  private final String password;
  private final String hostId;
  private final Clock clock;
  private volatile String authToken;
  private int requestId;

  @VisibleForTesting
  ZabbixClient(
      OkHttpClient client,
      String url,
      String username,
      String password,
      String hostId,
      Clock clock) {
    this.client = client;
    this.url = url;
    this.username = username;
    this.password = password;
    this.hostId = hostId;
    this.clock = clock;
  }

  public static ZabbixClient from(Config zabbixConfig, Clock clock) {
    Duration timeout =
        zabbixConfig.hasPath(TIMEOUT) ? zabbixConfig.getDuration(TIMEOUT) : DEFAULT_TIMEOUT;
    return new ZabbixClient(
        new OkHttpClient.Builder().callTimeout(timeout).build(),
        zabbixConfig.getString(URL),
        zabbixConfig.getString(USERNAME),
        zabbixConfig.getString(PASSWORD),
        zabbixConfig.hasPath(HOST_ID) ? zabbixConfig.getString(HOST_ID) : DEFAULT_HOST_ID,
        clock);
  }

  /** Latest value of every item of the configured host. Items without usable data are skipped. */
  public synchronized List<MetricRecord> getItems() throws IOException {
    JsonNode result;
    try {
      result = call("item.get", itemParams(), true);
    } catch (ZabbixAuthException e) {
      LOGGER.info("Zabbix session rejected, logging in again");
      authToken = null;
      result = call("item.get", itemParams(), true);
    }
    return toRecords(result);
  }

  private ObjectNode itemParams() {
    ObjectNode params = OBJECT_MAPPER.createObjectNode();
    params.set("output", OBJECT_MAPPER.valueToTree(ITEM_OUTPUT));
    params.put("hostids", hostId);
    return params;
  }

  @VisibleForTesting
  List<MetricRecord> toRecords(JsonNode items) {
    long recordedAt = clock.instant().getEpochSecond();
    List<MetricRecord> records = new ArrayList<>();
    for (JsonNode item : items) {
      String itemId = item.path("itemid").asText(null);
      String lastValue = item.path("lastvalue").asText(null);
      long lastClock = NumberUtils.toLong(item.path("lastclock").asText(), 0L);
      if (StringUtils.isBlank(itemId) || lastClock <= 0 || !NumberUtils.isParsable(lastValue)) {
        LOGGER.debug("Skipping Zabbix item without usable data: {}", item);
        continue;
      }
      records.add(
          MetricRecord.builder()
              .source(MetricSource.EXTERNAL)
              .key(itemId)
              .timestamp(lastClock)
              .value(Double.parseDouble(lastValue))
              .recordedAt(recordedAt)
              .label("name", item.path("name").asText(""))
              .label("hostid", item.path("hostid").asText(hostId))
              .build());
    }
    LOGGER.debug("Fetched {} Zabbix items for host {}", records.size(), hostId);
    return records;
  }

  private String login() throws IOException {
    ObjectNode params = OBJECT_MAPPER.createObjectNode();
    params.put(USERNAME, username);
    params.put(PASSWORD, password);
    JsonNode result = call("user.login", params, false);
    if (!result.isTextual()) {
      throw new IOException("Zabbix login did not return a session token");
    }
    return result.asText();
  }

  private JsonNode call(String method, ObjectNode params, boolean authenticated)
      throws IOException {
    ObjectNode payload = OBJECT_MAPPER.createObjectNode();
    payload.put("jsonrpc", "2.0");
    payload.put("method", method);
    payload.set("params", params);
    payload.put("id", ++requestId);
    if (authenticated) {
      if (authToken == null) {
        authToken = login();
      }
      payload.put("auth", authToken);
    }

    Request request =
        new Request.Builder()
            .url(url)
            .post(RequestBody.create(OBJECT_MAPPER.writeValueAsString(payload), JSON_RPC))
            .build();
    try (Response response = client.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        throw new IOException(
            String.format("Zabbix %s answered HTTP %d", method, response.code()));
      }
      JsonNode answer = OBJECT_MAPPER.readTree(body.string());
      if (answer.has("error")) {
        JsonNode error = answer.get("error");
        String detail = error.path("message").asText() + " " + error.path("data").asText();
        if (authenticated && isAuthError(detail)) {
          throw new ZabbixAuthException(detail);
        }
        throw new IOException(String.format("Zabbix %s failed: %s", method, detail.trim()));
      }
      if (!answer.has("result")) {
        throw new IOException(String.format("Zabbix %s returned no result", method));
      }
      return answer.get("result");
    }
  }

  private static boolean isAuthError(String detail) {
    return AUTH_ERROR_MARKERS.stream()
        .anyMatch(marker -> StringUtils.containsIgnoreCase(detail, marker));
  }

  static class ZabbixAuthException extends IOException {
    ZabbixAuthException(String message) {
      super(message);
    }
  }
}
