/*
 * どこで: Importer Webhook 配信
 * 何を: PENDING 配信を claim して 1 回だけ送信し、SUCCESS / FAILED で確定する
 * なぜ: 配信は再試行しない方針のため、lease 切れも含めて必ず 1 回で監査記録を閉じるため
 */
package com.example.importer.webhook;

import com.example.importer.config.WebhookDeliveryProperties;
import com.example.importer.metrics.ImporterMetrics;
import com.example.importer.model.WebhookDeliveryStatus;
import com.example.importer.repository.WebhookDeliveryRepository;
import com.example.importer.repository.WebhookDeliveryRepository.ClaimedDelivery;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookDeliveryService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  static final String LEASE_EXPIRED_ERROR = "Delivery lease expired before completion";

  private final WebhookDeliveryRepository deliveryRepository;
  private final WebhookSender sender;
  private final WebhookDeliveryProperties properties;
  private final ImporterMetrics metrics;
  private final Clock clock;

  /** @return 今回確定した配信件数 */
  public int processPendingBatch() {
    final Instant now = Instant.now(clock);
    final int expired = deliveryRepository.failExpiredLeases(now, LEASE_EXPIRED_ERROR);
    if (expired > 0) {
      logger.warn("webhook deliveries failed by lease expiry count={}", expired);
    }
    final String lockedBy = resolveLockedBy();
    // claim を単一 SQL で行い、送信 IO を長期トランザクションに載せない
    final List<ClaimedDelivery> claimed =
        deliveryRepository.claimPending(
            properties.batchSize(), now, now.plus(properties.lease()), lockedBy);
    int completed = 0;
    for (ClaimedDelivery delivery : claimed) {
      if (deliver(delivery, lockedBy)) {
        completed++;
      }
    }
    return completed;
  }

  private boolean deliver(ClaimedDelivery delivery, String lockedBy) {
    final WebhookSendResult result;
    try {
      result = sender.send(delivery.url(), delivery.eventType(), delivery.payloadJson());
    } catch (RuntimeException ex) {
      // 送信側の想定外エラーも FAILED として記録し、他の配信を止めない
      logger.error("webhook delivery crashed id={}", delivery.id(), ex);
      return finish(
          delivery,
          new WebhookSendResult(false, null, null, 0, truncateError(ex.toString())),
          lockedBy);
    }
    return finish(delivery, result, lockedBy);
  }

  private boolean finish(ClaimedDelivery delivery, WebhookSendResult result, String lockedBy) {
    final WebhookDeliveryStatus status =
        result.success() ? WebhookDeliveryStatus.SUCCESS : WebhookDeliveryStatus.FAILED;
    final int updated =
        deliveryRepository.complete(
            delivery.id(),
            status,
            result.responseCode(),
            result.responseBody(),
            result.responseTimeMs(),
            truncateError(result.errorMessage()),
            Instant.now(clock),
            lockedBy);
    metrics.recordWebhookDelivery(status.name(), (long) result.responseTimeMs());
    if (updated == 0) {
      logger.warn(
          "webhook delivered but lock was lost id={} webhookId={}",
          delivery.id(),
          delivery.webhookId());
      return false;
    }
    logger.info(
        "webhook delivery completed id={} webhookId={} eventType={} status={} responseCode={}",
        delivery.id(),
        delivery.webhookId(),
        delivery.eventType(),
        status,
        result.responseCode());
    return true;
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
