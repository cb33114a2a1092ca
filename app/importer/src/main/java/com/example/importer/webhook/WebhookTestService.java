/*
 * どこで: Importer Webhook
 * 何を: 指定 Webhook へテストイベントを同期送信し、結果をそのまま返す
 * なぜ: 登録直後に受信側の疎通と応答を利用者が確認できるようにするため
 */
package com.example.importer.webhook;

import com.example.importer.model.Webhook;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookTestService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookTestService.class);
  static final String TEST_EVENT = "webhook.test";
  static final String TEST_MESSAGE = "This is a test webhook event";

  private final WebhookService webhookService;
  private final WebhookSender sender;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /** テスト送信は配信履歴に残さない。 */
  public WebhookSendResult test(long webhookId) {
    final Webhook webhook = webhookService.get(webhookId);
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("webhook_id", webhook.id());
    data.put("message", TEST_MESSAGE);
    data.put("timestamp", Instant.now(clock).toString());
    final String payloadJson;
    try {
      payloadJson = objectMapper.writeValueAsString(WebhookEventPublisher.envelope(TEST_EVENT, data));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize webhook test payload", ex);
    }
    final WebhookSendResult result = sender.send(webhook.url(), TEST_EVENT, payloadJson);
    logger.info(
        "webhook test sent id={} success={} responseCode={} responseTimeMs={}",
        webhookId,
        result.success(),
        result.responseCode(),
        result.responseTimeMs());
    return result;
  }
}
