/*
 * どこで: Importer Webhook 配信ワーカー
 * 何を: スケジュールで配信処理を起動する
 * なぜ: PENDING 配信を一定間隔で処理するため
 */
package com.example.importer.webhook;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "importer.webhook.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class WebhookDeliveryWorker {

  private final WebhookDeliveryService deliveryService;

  @Scheduled(fixedDelayString = "${importer.webhook.delivery.poll-interval}")
  public void run() {
    deliveryService.processPendingBatch();
  }
}
