package org.hypertrace.logalert.notification.transport.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.Optional;
import okhttp3.Response;
import org.hypertrace.logalert.notification.transport.webhook.http.HttpWithJsonSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes a payload to JSON and posts it to a webhook, treating any 2xx answer as success. */
public class WebhookSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSender.class);
  private final HttpWithJsonSender sender;

  public WebhookSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public boolean send(String url, Object payload) {
    return send(url, Map.of(), payload);
  }

  public boolean send(String url, Map<String, String> headers, Object payload) {
    Preconditions.checkArgument(url != null, "webhook url is required");
    ObjectMapper objectMapper = ObjectMapperProvider.get();
    String jsonString;
    try {
      jsonString = objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      LOGGER.error(
          "Failed to send notification due to JSON serialization. Payload to serialize: {}",
          payload,
          e);
      return false;
    }

    Optional<Response> responseOptional = sender.send(url, headers, jsonString);
    if (responseOptional.isEmpty()) {
      LOGGER.error("Failed sending webhook message to {}: {}", url, jsonString);
      return false;
    }
    Response response = responseOptional.get();
    int responseCode = response.code();
    LOGGER.debug("Webhook {} answered with code {}", url, responseCode);
    if (!response.isSuccessful()) {
      LOGGER.error(
          "Error response from webhook when attempting to send notification. "
              + "Response Code: {}, Response Message: {} \n Attempted Notification: {}",
          responseCode,
          response.message(),
          jsonString);
      return false;
    }
    return true;
  }
}
