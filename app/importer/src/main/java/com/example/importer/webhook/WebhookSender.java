/*
 * どこで: Importer Webhook
 * 何を: Webhook URL へ JSON envelope を 1 回だけ POST し、結果を記録用の値に変換する
 * なぜ: 同期テストと非同期配信で同じタイムアウト・本文切り詰め・エラー表現を使うため
 */
package com.example.importer.webhook;

import com.example.importer.config.WebhookProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class WebhookSender {

  private static final Logger logger = LoggerFactory.getLogger(WebhookSender.class);
  static final String EVENT_HEADER = "X-Webhook-Event";

  private final RestClient webhookRestClient;
  private final WebhookProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public WebhookSender(RestClient webhookRestClient, WebhookProperties properties) {
    this.webhookRestClient = webhookRestClient;
    this.properties = properties;
  }

  public WebhookSendResult send(String url, String eventType, String payloadJson) {
    final long startedAt = System.nanoTime();
    try {
      final HttpOutcome outcome =
          webhookRestClient
              .post()
              .uri(URI.create(url))
              .contentType(MediaType.APPLICATION_JSON)
              .header(EVENT_HEADER, eventType)
              .body(payloadJson)
              .exchange(
                  (request, response) ->
                      new HttpOutcome(
                          response.getStatusCode().value(), readBody(response.getBody())));
      final boolean success = outcome.statusCode() >= 200 && outcome.statusCode() < 300;
      return new WebhookSendResult(
          success,
          outcome.statusCode(),
          outcome.body(),
          elapsedMillis(startedAt),
          success ? null : "HTTP " + outcome.statusCode());
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("webhook request timed out url={} eventType={}", url, eventType);
        return failure("Request timed out after " + describeTimeout(), startedAt);
      }
      logger.warn("webhook connection failed url={} eventType={}", url, eventType, ex);
      return failure("Connection error: " + rootMessage(ex), startedAt);
    } catch (RestClientException | IllegalArgumentException ex) {
      logger.warn("webhook request failed url={} eventType={}", url, eventType, ex);
      return failure("Request error: " + rootMessage(ex), startedAt);
    }
  }

  private String readBody(InputStream body) throws IOException {
    if (body == null) {
      return null;
    }
    // 上限を超えた分は読まずに捨てる
    final int maxLength = properties.responseBodyMaxLength();
    final char[] buffer = new char[maxLength];
    int total = 0;
    try (Reader reader = new InputStreamReader(body, StandardCharsets.UTF_8)) {
      while (total < maxLength) {
        final int read = reader.read(buffer, total, maxLength - total);
        if (read < 0) {
          break;
        }
        total += read;
      }
    }
    return new String(buffer, 0, total);
  }

  private String describeTimeout() {
    final long millis = properties.readTimeout().toMillis();
    return millis % 1000L == 0L ? (millis / 1000L) + "s" : millis + "ms";
  }

  private WebhookSendResult failure(String errorMessage, long startedAt) {
    return new WebhookSendResult(false, null, null, elapsedMillis(startedAt), errorMessage);
  }

  private int elapsedMillis(long startedAt) {
    return (int) Math.min(Integer.MAX_VALUE, (System.nanoTime() - startedAt) / 1_000_000L);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private String rootMessage(Throwable ex) {
    Throwable current = ex;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
  }

  private record HttpOutcome(int statusCode, String body) {}
}
