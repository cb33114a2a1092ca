package com.example.importer.api.response;

import com.example.importer.webhook.WebhookSendResult;

public record WebhookTestResponse(
    boolean success,
    Integer responseCode,
    Integer responseTimeMs,
    String responseBody,
    String error) {

  public static WebhookTestResponse from(WebhookSendResult result) {
    return new WebhookTestResponse(
        result.success(),
        result.responseCode(),
        result.responseTimeMs(),
        result.responseBody(),
        result.errorMessage());
  }
}
