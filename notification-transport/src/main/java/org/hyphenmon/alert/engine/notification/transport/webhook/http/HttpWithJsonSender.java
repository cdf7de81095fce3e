package org.hyphenmon.alert.engine.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts a JSON string to a URL. Stateless apart from the shared client; every call is bounded by
 * the configured call timeout.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private final OkHttpClient client;

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender create(Duration callTimeout) {
    return new HttpWithJsonSender(
        new OkHttpClient.Builder()
            .callTimeout(callTimeout)
            .connectTimeout(callTimeout)
            .readTimeout(callTimeout)
            .build());
  }

  /** Returns the closed response, or empty when the request could not be completed. */
  public Optional<Response> send(String url, String jsonString) {
    LOGGER.debug("Posting json string to {}: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request request = new Request.Builder().url(url).post(body).build();
    try (Response response = client.newCall(request).execute()) {
      return Optional.of(response);
    } catch (IOException ioe) {
      LOGGER.error("Unable to send json string to URL: {}", url, ioe);
    }
    return Optional.empty();
  }
}
