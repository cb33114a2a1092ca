package com.example.importer.api.response;

import com.example.importer.model.WebhookDelivery;
import java.time.Instant;
import java.util.Locale;

public record WebhookDeliveryResponse(
    long id,
    long webhookId,
    String eventType,
    String status,
    Integer responseCode,
    Integer responseTimeMs,
    String responseBody,
    String errorMessage,
    Instant attemptedAt,
    Instant completedAt) {

  public static WebhookDeliveryResponse from(WebhookDelivery delivery) {
    return new WebhookDeliveryResponse(
        delivery.id(),
        delivery.webhookId(),
        delivery.eventType(),
        delivery.status().name().toLowerCase(Locale.ROOT),
        delivery.responseCode(),
        delivery.responseTimeMs(),
        delivery.responseBody(),
        delivery.errorMessage(),
        delivery.attemptedAt(),
        delivery.completedAt());
  }
}
