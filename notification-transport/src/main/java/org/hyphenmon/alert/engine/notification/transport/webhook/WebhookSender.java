package org.hyphenmon.alert.engine.notification.transport.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Optional;
import okhttp3.Response;
import org.hyphenmon.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes a payload to JSON and posts it; only a 2xx answer counts as delivered. */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public boolean send(String url, Object payload) {
    Preconditions.checkArgument(url != null, "webhook url is required");
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(payload);
    } catch (IOException e) {
      LOGGER.error("Failed to serialize webhook payload: {}", payload, e);
      return false;
    }

    Optional<Response> responseOptional = sender.send(url, jsonString);
    if (responseOptional.isEmpty()) {
      LOGGER.error("Failed sending webhook payload to {}", url);
      return false;
    }
    Response response = responseOptional.get();
    if (!response.isSuccessful()) {
      LOGGER.error(
          "Error response from webhook {}. Response Code: {}, Response Message: {}",
          url,
          response.code(),
          response.message());
      return false;
    }
    LOGGER.debug("Webhook {} answered {}", url, response.code());
    return true;
  }
}
