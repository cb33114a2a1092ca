/*
 * どこで: Importer Webhook
 * 何を: ドメインイベントを購読中の Webhook ごとに PENDING 配信として登録する
 * なぜ: 呼び出し元(ジョブ終端・商品更新)を HTTP 送信から切り離し、失敗させないため
 */
package com.example.importer.webhook;

import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.Webhook;
import com.example.importer.model.WebhookEventType;
import com.example.importer.repository.WebhookDeliveryRepository;
import com.example.importer.repository.WebhookRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebhookEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(WebhookEventPublisher.class);

  private final WebhookRepository webhookRepository;
  private final WebhookDeliveryRepository deliveryRepository;
  private final ImporterMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * イベントを登録する。失敗はログに残すだけで呼び出し元へは投げない。
   *
   * @return 登録した配信件数
   */
  public int publish(WebhookEventType eventType, Map<String, Object> data) {
    final List<Webhook> webhooks;
    final String payloadJson;
    try {
      webhooks = webhookRepository.findEnabledByEvent(eventType.value());
      if (webhooks.isEmpty()) {
        logger.debug("no webhook subscribes eventType={}", eventType.value());
        return 0;
      }
      payloadJson = objectMapper.writeValueAsString(envelope(eventType, data));
    } catch (JsonProcessingException | RuntimeException ex) {
      logger.error("failed to publish webhook event eventType={}", eventType.value(), ex);
      metrics.recordDependencyError("webhook_publish");
      return 0;
    }
    final Instant now = Instant.now(clock);
    int published = 0;
    for (Webhook webhook : webhooks) {
      try {
        deliveryRepository.insertPending(webhook.id(), eventType.value(), payloadJson, now);
        published++;
      } catch (RuntimeException ex) {
        // 1 件の失敗で他の Webhook への登録を止めない
        logger.error(
            "failed to enqueue webhook delivery webhookId={} eventType={}",
            webhook.id(),
            eventType.value(),
            ex);
        metrics.recordDependencyError("webhook_publish");
      }
    }
    logger.info("webhook event published eventType={} deliveries={}", eventType.value(), published);
    return published;
  }

  static Map<String, Object> envelope(String eventType, Map<String, Object> data) {
    final Map<String, Object> envelope = new LinkedHashMap<>();
    envelope.put("event", eventType);
    envelope.put("data", data);
    return envelope;
  }

  private static Map<String, Object> envelope(WebhookEventType eventType, Map<String, Object> data) {
    return envelope(eventType.value(), data);
  }
}
