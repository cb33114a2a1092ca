package com.example.importer.api.response;

import com.example.importer.model.Webhook;
import java.time.Instant;
import java.util.List;

public record WebhookResponse(
    long id, String url, List<String> events, boolean enabled, Instant createdAt, Instant updatedAt) {

  public static WebhookResponse from(Webhook webhook) {
    return new WebhookResponse(
        webhook.id(),
        webhook.url(),
        webhook.events(),
        webhook.enabled(),
        webhook.createdAt(),
        webhook.updatedAt());
  }
}
