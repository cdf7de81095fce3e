package org.hyphenmon.alert.engine.notification.service.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.hyphenmon.alert.engine.metric.correlation.datamodel.Severity;
import org.hyphenmon.alert.engine.notification.transport.webhook.ObjectMapperProvider;
import org.hyphenmon.alert.engine.notification.transport.webhook.WebhookSender;
import org.hyphenmon.alert.engine.notification.transport.webhook.http.HttpWithJsonSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookChannelsTest {

  private MockWebServer mockWebServer;
  private WebhookSender webhookSender;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    webhookSender = new WebhookSender(HttpWithJsonSender.create(Duration.ofSeconds(5)));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testSlackChannelPostsAttachment() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    SlackNotificationChannel channel =
        SlackNotificationChannel.builder()
            .channelName("slack")
            .channelType("SLACK")
            .minSeverity(Severity.WARN)
            .recipients(List.of(mockWebServer.url("/slack").toString()))
            .webhookSender(webhookSender)
            .build();

    assertTrue(
        channel.send(
            "[CRITICAL] error-rate-exceeded", "Rule: error-rate-exceeded",
            channel.getRecipients().get(0)));

    JsonNode body =
        ObjectMapperProvider.get()
            .readTree(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
    assertEquals("[CRITICAL] error-rate-exceeded", body.get("text").asText());
    assertEquals("#d41729", body.get("attachments").get(0).get("color").asText());
    JsonNode blocks = body.get("attachments").get(0).get("blocks");
    assertEquals(2, blocks.size());
    assertEquals(
        "*[CRITICAL] error-rate-exceeded*", blocks.get(0).get("text").get("text").asText());
    for (JsonNode block : blocks) {
      // a section carries its type and text only
      assertEquals(2, block.size());
      assertEquals("section", block.get("type").asText());
      assertFalse(block.has("fields"));
    }
  }

  @Test
  void testWebhookChannelPostsSubjectAndBody() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(204));
    WebhookNotificationChannel channel =
        WebhookNotificationChannel.builder()
            .channelName("hook")
            .channelType("WEBHOOK")
            .minSeverity(Severity.WARN)
            .recipients(List.of(mockWebServer.url("/alerts").toString()))
            .webhookSender(webhookSender)
            .build();

    assertTrue(channel.send("[WARN] slow", "details", channel.getRecipients().get(0)));

    JsonNode body =
        ObjectMapperProvider.get()
            .readTree(mockWebServer.takeRequest(1, TimeUnit.SECONDS).getBody().readUtf8());
    assertEquals("[WARN] slow", body.get("subject").asText());
    assertEquals("details", body.get("body").asText());
    assertTrue(body.has("sentAt"));
  }

  @Test
  void testServerErrorIsReportedAsNotSent() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));
    WebhookNotificationChannel channel =
        WebhookNotificationChannel.builder()
            .channelName("hook")
            .channelType("WEBHOOK")
            .minSeverity(Severity.WARN)
            .recipients(List.of(mockWebServer.url("/alerts").toString()))
            .webhookSender(webhookSender)
            .build();

    assertFalse(channel.send("s", "b", channel.getRecipients().get(0)));
  }
}
