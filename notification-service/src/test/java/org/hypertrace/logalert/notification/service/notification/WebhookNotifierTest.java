package org.hypertrace.logalert.notification.service.notification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.hypertrace.logalert.datamodel.AlertCondition;
import org.hypertrace.logalert.datamodel.AlertRule;
import org.hypertrace.logalert.datamodel.AlertSeverity;
import org.hypertrace.logalert.notification.transport.webhook.WebhookSender;
import org.hypertrace.logalert.notification.transport.webhook.http.HttpWithJsonSender;
import org.hypertrace.logalert.notification.transport.webhook.slack.Attachment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookNotifierTest {
  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final AlertRule rule =
      AlertRule.builder()
          .name("High Error Rate")
          .description("Error rate above 5%")
          .condition(AlertCondition.THRESHOLD)
          .parameters(Map.of("metric", "error_rate", "threshold", 0.05))
          .severity(AlertSeverity.CRITICAL)
          .notifierNames(List.of("hook"))
          .build();
  private final WebhookSender webhookSender =
      new WebhookSender(new HttpWithJsonSender(Duration.ofSeconds(2)));
  private MockWebServer mockWebServer;
  private Map<String, Object> context;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    context = new LinkedHashMap<>();
    context.put("metric", "error_rate");
    context.put("current_value", 0.25);
    context.put("matching_logs", List.of(Map.of("message", "boom")));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testJsonPayload() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));

    assertTrue(notifier(WebhookFormat.JSON).send(rule, context));

    RecordedRequest request = mockWebServer.takeRequest();
    assertEquals("token", request.getHeader("X-Api-Key"));
    JsonNode body = OBJECT_MAPPER.readTree(request.getBody().readUtf8());
    assertEquals("High Error Rate", body.at("/alert/name").asText());
    assertEquals("Error rate above 5%", body.at("/alert/description").asText());
    assertEquals("critical", body.at("/alert/severity").asText());
    assertEquals("2024-03-01T10:00:00Z", body.at("/alert/time").asText());
    assertEquals(0.25, body.at("/context/current_value").asDouble());
    assertEquals("boom", body.at("/context/matching_logs/0/message").asText());
  }

  @Test
  void testSlackPayload() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));

    assertTrue(notifier(WebhookFormat.SLACK).send(rule, context));

    JsonNode body = OBJECT_MAPPER.readTree(mockWebServer.takeRequest().getBody().readUtf8());
    JsonNode attachment = body.at("/attachments/0");
    assertEquals(Attachment.RED, attachment.get("color").asText());
    assertEquals(
        "*[CRITICAL] High Error Rate*", attachment.at("/blocks/0/text/text").asText());
    JsonNode fields = attachment.at("/blocks/1/fields");
    assertEquals("*Severity:*\ncritical", fields.get(0).get("text").asText());
    assertTrue(fields.get(1).get("text").asText().contains("<!date^1709287200^"));
    assertEquals(
        "*Details:*\nmetric: error_rate\ncurrent_value: 0.25", fields.get(3).get("text").asText());
    assertEquals("context", attachment.at("/blocks/2/type").asText());
  }

  @Test
  void testErrorResponse() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));

    assertFalse(notifier(WebhookFormat.JSON).send(rule, context));
  }

  private WebhookNotifier notifier(WebhookFormat format) {
    return WebhookNotifier.builder()
        .name("hook")
        .url(mockWebServer.url("/alerts").toString())
        .headers(Map.of("X-Api-Key", "token"))
        .format(format)
        .webhookSender(webhookSender)
        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
        .build();
  }
}
