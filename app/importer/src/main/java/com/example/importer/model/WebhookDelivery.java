package com.example.importer.model;

import java.time.Instant;

/** 配信 1 回分の監査記録。PENDING から 1 度だけ確定する。 */
public record WebhookDelivery(
    long id,
    long webhookId,
    String eventType,
    String payloadJson,
    WebhookDeliveryStatus status,
    Integer responseCode,
    String responseBody,
    Integer responseTimeMs,
    String errorMessage,
    Instant attemptedAt,
    Instant completedAt) {}
