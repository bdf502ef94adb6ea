package org.hypertrace.logalert.notification.transport.webhook.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic sender that posts a JSON string to a URL. It keeps no state besides the HTTP client, so
 * one instance can be shared by every webhook with the same timeout.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
  private static final HttpWithJsonSender INSTANCE = new HttpWithJsonSender(DEFAULT_TIMEOUT);

  private final OkHttpClient client;

  public HttpWithJsonSender(Duration timeout) {
    this(new OkHttpClient.Builder().callTimeout(timeout).build());
  }

  @VisibleForTesting
  HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender getInstance() {
    return INSTANCE;
  }

  /**
   * Posts the JSON body. The returned response is already closed; only its status line can be
   * read. An empty result means the request never completed.
   */
  public Optional<Response> send(String url, Map<String, String> headers, String jsonString) {
    LOGGER.debug("Sending the following json string to {}: {}", url, jsonString);
    RequestBody body = RequestBody.create(jsonString, JSON);
    Request.Builder requestBuilder = new Request.Builder().url(url).post(body);
    headers.forEach(requestBuilder::header);
    try (Response response = client.newCall(requestBuilder.build()).execute()) {
      return Optional.of(response);
    } catch (IOException ioe) {
      LOGGER.error("Unable to send json string to URL: {}, with message: {}", url, jsonString, ioe);
    }
    return Optional.empty();
  }
}
